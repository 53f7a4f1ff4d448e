package io.github.drompincen.clawguard.runtime.config;

import io.github.drompincen.clawguard.protocol.api.ActionPolicy;
import io.github.drompincen.clawguard.protocol.api.ApprovalMode;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "clawguard")
public record ClawGuardProperties(
        @DefaultValue("5") int maxDepth,
        @DefaultValue Approval approval,
        @DefaultValue Policy policy,
        @DefaultValue Delegation delegation
) {
    public record Approval(
            @DefaultValue("APPROVE_ALL") ApprovalMode mode,
            @DefaultValue("5m") Duration timeout,
            @DefaultValue("false") boolean returnPermissionErrors
    ) {}

    public record Policy(
            @DefaultValue("NEEDS_APPROVAL") CapabilityRule defaultRule,
            Map<String, CapabilityRule> capabilityRules,
            Map<String, ActionPolicy> actions,
            Map<String, Set<String>> capabilityMap
    ) {
        public PolicyConfig toPolicyConfig() {
            return new PolicyConfig(actions, capabilityRules, defaultRule, capabilityMap);
        }
    }

    public record Delegation(
            @DefaultValue("false") boolean callsRequireApproval
    ) {}

    public ClawGuardProperties {
        if (approval == null) approval = new Approval(ApprovalMode.APPROVE_ALL, Duration.ofMinutes(5), false);
        if (policy == null) policy = new Policy(CapabilityRule.NEEDS_APPROVAL, null, null, null);
        if (delegation == null) delegation = new Delegation(false);
    }

    public static ClawGuardProperties defaults() {
        return new ClawGuardProperties(5, null, null, null);
    }

    public ClawGuardProperties withApproval(ApprovalMode mode, boolean returnPermissionErrors) {
        return new ClawGuardProperties(maxDepth, new Approval(mode, approval.timeout(), returnPermissionErrors),
                policy, delegation);
    }

    public ClawGuardProperties withApprovalTimeout(Duration timeout) {
        return new ClawGuardProperties(maxDepth,
                new Approval(approval.mode(), timeout, approval.returnPermissionErrors()), policy, delegation);
    }

    public ClawGuardProperties withMaxDepth(int depth) {
        return new ClawGuardProperties(depth, approval, policy, delegation);
    }

    public ClawGuardProperties withPolicy(PolicyConfig config) {
        return new ClawGuardProperties(maxDepth, approval,
                new Policy(config.defaultRule(), config.capabilityRules(), config.actions(), config.capabilityMap()),
                delegation);
    }

    public ClawGuardProperties withDelegationApproval(boolean required) {
        return new ClawGuardProperties(maxDepth, approval, policy, new Delegation(required));
    }
}
