package io.github.drompincen.clawguard.tools;

import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.ShellRule;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.util.List;

/**
 * Outcome of whitelist matching: the argv to run and what allowed it. {@code rule} is
 * {@code null} when the command was admitted by the default.
 */
public record ShellAuthorization(
        List<String> argv,
        ShellRule rule,
        boolean approvalRequired
) {
    public static final String CAP_EXEC = "process.exec";
    public static final String CAP_EXEC_UNLISTED = "process.exec.unlisted";

    public boolean viaDefault() {
        return rule == null;
    }

    public CapabilitySet capabilities() {
        return CapabilitySet.suggesting(viaDefault() ? CAP_EXEC_UNLISTED : CAP_EXEC,
                approvalRequired ? CapabilityRule.NEEDS_APPROVAL : CapabilityRule.PRE_APPROVED);
    }
}
