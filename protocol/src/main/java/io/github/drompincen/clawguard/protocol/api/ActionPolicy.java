package io.github.drompincen.clawguard.protocol.api;

import java.util.Set;

/**
 * Static per-action configuration. {@code approvalRequired} is the action's own default,
 * consulted only when no capability decides the outcome; {@code null} means unset.
 */
public record ActionPolicy(
        boolean preApproved,
        boolean blocked,
        String blockReason,
        Set<String> capabilities,
        Boolean approvalRequired
) {
    public ActionPolicy {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static ActionPolicy allow() {
        return new ActionPolicy(true, false, null, Set.of(), null);
    }

    public static ActionPolicy block(String reason) {
        return new ActionPolicy(false, true, reason, Set.of(), null);
    }

    public static ActionPolicy withCapabilities(String... capabilities) {
        return new ActionPolicy(false, false, null, Set.of(capabilities), null);
    }

    public static ActionPolicy approvalRequired(boolean required) {
        return new ActionPolicy(false, false, null, Set.of(), required);
    }
}
