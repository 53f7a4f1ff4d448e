package io.github.drompincen.clawguard.protocol.event;

public enum EventType {
    USER_MESSAGE,
    BRANCH_STATE_CHANGED,
    ACTION_CALL_STARTED,
    ACTION_CALL_RESULT,
    APPROVAL_REQUESTED,
    FINAL_RESULT,
    ERROR
}
