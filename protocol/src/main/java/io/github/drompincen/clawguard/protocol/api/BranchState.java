package io.github.drompincen.clawguard.protocol.api;

public enum BranchState {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED,
    DEPTH_EXCEEDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == DEPTH_EXCEEDED;
    }
}
