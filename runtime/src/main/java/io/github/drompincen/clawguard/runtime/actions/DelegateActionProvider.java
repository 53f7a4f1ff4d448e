package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.call.TaskResult;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.util.List;
import java.util.Set;

/**
 * Exposes a sub-task as an action. Invoking it forks a child branch one level deeper.
 */
public class DelegateActionProvider implements ActionProvider {

    public static final String CAPABILITY = "delegation.call";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PREVIEW_CHARS = 80;

    private final TaskDefinition target;
    private final boolean requiresApproval;

    public DelegateActionProvider(TaskDefinition target, boolean requiresApproval) {
        this.target = target;
        this.requiresApproval = requiresApproval;
    }

    public TaskDefinition target() {
        return target;
    }

    @Override public String id() { return "delegate:" + target.name(); }

    @Override
    public List<ActionDescriptor> actions() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("input").put("type", "string").put("description", "Prompt for the " + target.name() + " task");
        schema.putArray("required").add("input");
        return List.of(new ActionDescriptor(target.name(), target.description(), schema, Set.of(CAPABILITY)));
    }

    @Override
    public CapabilitySet capabilities(ActionRequest request) {
        return CapabilitySet.suggesting(CAPABILITY,
                requiresApproval ? CapabilityRule.NEEDS_APPROVAL : CapabilityRule.PRE_APPROVED);
    }

    @Override
    public String describe(ActionRequest request) {
        String input = request.stringArg("input");
        if (input == null) input = "";
        if (input.length() > PREVIEW_CHARS) input = input.substring(0, PREVIEW_CHARS) + "...";
        return "Delegate to " + target.name() + ": " + input;
    }

    @Override
    public ActionResult invoke(ActionRequest request, CallContext context) {
        String input = request.stringArg("input");
        TaskResult result = context.delegate(target, input == null ? "" : input);
        JsonNode output = result.output();
        return ActionResult.success(output);
    }
}
