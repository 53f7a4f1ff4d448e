package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A named group of actions offered to a branch.
 */
public interface ActionProvider {

    String id();

    List<ActionDescriptor> actions();

    /** Self-reported capability labels for a request; may reject it outright. */
    default CapabilitySet capabilities(ActionRequest request) {
        return CapabilitySet.empty();
    }

    /** Human-readable summary shown to an approver. */
    default String describe(ActionRequest request) {
        StringBuilder sb = new StringBuilder(request.name()).append('(');
        Iterator<Map.Entry<String, JsonNode>> fields = request.arguments().fields();
        boolean first = true;
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!first) sb.append(", ");
            JsonNode value = field.getValue();
            sb.append(field.getKey()).append('=').append(value.isValueNode() ? value.asText() : value.toString());
            first = false;
        }
        return sb.append(')').toString();
    }

    ActionResult invoke(ActionRequest request, CallContext context);
}
