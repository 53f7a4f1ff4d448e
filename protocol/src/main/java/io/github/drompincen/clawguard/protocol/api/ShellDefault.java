package io.github.drompincen.clawguard.protocol.api;

/**
 * Fallback for commands no rule matches. Absent means such commands are rejected.
 */
public record ShellDefault(boolean approvalRequired) {

    public static ShellDefault requiringApproval() {
        return new ShellDefault(true);
    }
}
