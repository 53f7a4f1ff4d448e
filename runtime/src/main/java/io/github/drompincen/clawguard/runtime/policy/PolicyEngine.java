package io.github.drompincen.clawguard.runtime.policy;

import io.github.drompincen.clawguard.protocol.api.ActionPolicy;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.ApprovalOutcome;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a request to exactly one {@link ApprovalOutcome}. Evaluation order, first match wins:
 * <ol>
 *   <li>per-action {@code blocked}</li>
 *   <li>per-action {@code preApproved}</li>
 *   <li>capability rules: any blocked label, then any label needing approval, then pre-approved</li>
 *   <li>per-action {@code approvalRequired}</li>
 *   <li>needs approval</li>
 * </ol>
 */
@Component
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);
    static final String DEFAULT_BLOCK_REASON = "Blocked by approval policy";

    private final CapabilityResolver resolver;

    public PolicyEngine(CapabilityResolver resolver) {
        this.resolver = resolver;
    }

    public CapabilityResolver resolver() {
        return resolver;
    }

    public ApprovalOutcome evaluate(ActionRequest request, PolicyConfig config) {
        return evaluate(request, resolver.resolve(request, config), config);
    }

    public ApprovalOutcome evaluate(ActionRequest request, CapabilitySet capabilities, PolicyConfig config) {
        ApprovalOutcome outcome = decide(request, capabilities, config);
        log.debug("Policy outcome for {}: {}", request.name(), outcome.status());
        return outcome;
    }

    private ApprovalOutcome decide(ActionRequest request, CapabilitySet capabilities, PolicyConfig config) {
        ActionPolicy actionPolicy = config.action(request.name());
        if (actionPolicy != null && actionPolicy.blocked()) {
            String reason = actionPolicy.blockReason() != null && !actionPolicy.blockReason().isBlank()
                    ? actionPolicy.blockReason() : DEFAULT_BLOCK_REASON;
            return ApprovalOutcome.blocked(reason);
        }
        if (actionPolicy != null && actionPolicy.preApproved()) {
            return ApprovalOutcome.preApproved();
        }

        if (!capabilities.isEmpty()) {
            boolean needsApproval = false;
            for (String label : capabilities.sortedLabels()) {
                CapabilityRule rule = ruleFor(label, capabilities, config);
                if (rule == CapabilityRule.BLOCKED) {
                    return ApprovalOutcome.blocked("Capability blocked: " + label);
                }
                if (rule == CapabilityRule.NEEDS_APPROVAL) {
                    needsApproval = true;
                }
            }
            return needsApproval ? ApprovalOutcome.needingApproval() : ApprovalOutcome.preApproved();
        }

        if (actionPolicy != null && actionPolicy.approvalRequired() != null) {
            return actionPolicy.approvalRequired() ? ApprovalOutcome.needingApproval() : ApprovalOutcome.preApproved();
        }
        return ApprovalOutcome.needingApproval();
    }

    CapabilityRule ruleFor(String label, CapabilitySet capabilities, PolicyConfig config) {
        CapabilityRule explicit = config.capabilityRules().get(label);
        if (explicit != null) return explicit;
        return capabilities.suggestedRule(label).orElse(config.defaultRule());
    }
}
