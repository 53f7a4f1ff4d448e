package io.github.drompincen.clawguard.protocol.api;

import java.util.List;

/**
 * Whitelist entry for external commands. {@code pattern} is matched as a token prefix
 * of the command line; every non-flag argument after it must resolve inside one of
 * {@code requiredRoots} when that list is non-empty.
 */
public record ShellRule(
        String pattern,
        List<String> requiredRoots,
        boolean approvalRequired,
        List<String> approvalRequiredIfArgs
) {
    public ShellRule {
        if (pattern == null || pattern.isBlank()) throw new IllegalArgumentException("Shell rule pattern is required");
        requiredRoots = requiredRoots == null ? List.of() : List.copyOf(requiredRoots);
        approvalRequiredIfArgs = approvalRequiredIfArgs == null ? List.of() : List.copyOf(approvalRequiredIfArgs);
    }

    public static ShellRule preApproved(String pattern) {
        return new ShellRule(pattern, List.of(), false, List.of());
    }

    public static ShellRule requiringApproval(String pattern) {
        return new ShellRule(pattern, List.of(), true, List.of());
    }
}
