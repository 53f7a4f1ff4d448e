package io.github.drompincen.clawguard.runtime.approval;

import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionResult;
import io.github.drompincen.clawguard.runtime.actions.WrappedActionProvider;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.errors.PolicyDeniedException;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.util.List;

/**
 * Reports blocked or denied calls as failed results so the task executor can read them and continue.
 */
public class PermissionErrorResultProvider implements WrappedActionProvider {

    private final ActionProvider inner;

    public PermissionErrorResultProvider(ActionProvider inner) {
        this.inner = inner;
    }

    @Override public ActionProvider inner() { return inner; }
    @Override public String id() { return inner.id(); }
    @Override public List<ActionDescriptor> actions() { return inner.actions(); }
    @Override public CapabilitySet capabilities(ActionRequest request) { return inner.capabilities(request); }
    @Override public String describe(ActionRequest request) { return inner.describe(request); }

    @Override
    public ActionResult invoke(ActionRequest request, CallContext context) {
        try {
            return inner.invoke(request, context);
        } catch (PolicyDeniedException e) {
            return ActionResult.permissionDenied(e.getMessage());
        }
    }
}
