package io.github.drompincen.clawguard.protocol.api;

/**
 * Rule attached to a capability label. Declared from most to least restrictive.
 */
public enum CapabilityRule {
    BLOCKED,
    NEEDS_APPROVAL,
    PRE_APPROVED
}
