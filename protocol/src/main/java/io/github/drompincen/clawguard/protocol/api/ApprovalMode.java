package io.github.drompincen.clawguard.protocol.api;

public enum ApprovalMode {
    APPROVE_ALL,
    REJECT_ALL,
    INTERACTIVE
}
