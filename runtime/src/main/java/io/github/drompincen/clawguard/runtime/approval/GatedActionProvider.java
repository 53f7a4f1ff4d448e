package io.github.drompincen.clawguard.runtime.approval;

import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.ApprovalDecision;
import io.github.drompincen.clawguard.protocol.api.ApprovalOutcome;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.protocol.event.EventType;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionResult;
import io.github.drompincen.clawguard.runtime.actions.WrappedActionProvider;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.errors.PolicyDeniedException;
import io.github.drompincen.clawguard.runtime.errors.SandboxViolationException;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;
import io.github.drompincen.clawguard.runtime.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every invocation through capability resolution, the policy engine and, when needed,
 * the approval gateway before the wrapped provider sees it.
 */
public class GatedActionProvider implements WrappedActionProvider {

    private static final Logger log = LoggerFactory.getLogger(GatedActionProvider.class);

    private final ActionProvider inner;
    private final PolicyEngine engine;
    private final PolicyConfig policy;
    private final ApprovalGateway gateway;

    public GatedActionProvider(ActionProvider inner, PolicyEngine engine, PolicyConfig policy, ApprovalGateway gateway) {
        this.inner = inner;
        this.engine = engine;
        this.policy = policy;
        this.gateway = gateway;
    }

    @Override public ActionProvider inner() { return inner; }
    @Override public String id() { return inner.id(); }
    @Override public List<ActionDescriptor> actions() { return inner.actions(); }
    @Override public CapabilitySet capabilities(ActionRequest request) { return inner.capabilities(request); }

    @Override
    public String describe(ActionRequest request) {
        return inner.describe(request);
    }

    @Override
    public ActionResult invoke(ActionRequest request, CallContext context) {
        try {
            CapabilitySet capabilities = engine.resolver().resolve(request, policy, inner);
            ApprovalOutcome outcome = engine.evaluate(request, capabilities, policy);

            if (outcome.isBlocked()) {
                log.warn("Blocked action {}: {}", request.name(), outcome.reason());
                throw PolicyDeniedException.blocked(request.name(), outcome.reason());
            }
            if (outcome.needsApproval()) {
                String description = approvalDescription(request, capabilities);
                if (context != null) {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("action", request.name());
                    payload.put("description", description);
                    context.emit(EventType.APPROVAL_REQUESTED, payload);
                }
                ApprovalDecision decision = gateway.request(request, description);
                if (!decision.approved()) {
                    log.warn("Approval denied for {}: {}", request.name(), decision.note());
                    throw PolicyDeniedException.denied(request.name(), decision.note());
                }
            }
            return inner.invoke(request, context);
        } catch (SandboxViolationException e) {
            log.warn("Sandbox violation in {}: {}", request.name(), e.getMessage());
            return ActionResult.failure(e.getMessage(), ActionResult.SANDBOX_VIOLATION);
        }
    }

    String approvalDescription(ActionRequest request, CapabilitySet capabilities) {
        String description = inner.describe(request);
        if (!capabilities.isEmpty()) {
            description += " [caps: " + String.join(", ", capabilities.sortedLabels()) + "]";
        }
        return description;
    }
}
