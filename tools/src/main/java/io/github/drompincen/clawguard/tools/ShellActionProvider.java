package io.github.drompincen.clawguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionResult;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.util.List;
import java.util.Set;

public class ShellActionProvider implements ActionProvider {

    public static final String ACTION = "shell";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PREVIEW_CHARS = 80;

    private final WhitelistExecutor executor;

    public ShellActionProvider(WhitelistExecutor executor) {
        this.executor = executor;
    }

    @Override public String id() { return "shell"; }

    @Override
    public List<ActionDescriptor> actions() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("command").put("type", "string")
                .put("description", "Single whitelisted command; pipes, redirects and chaining are rejected");
        props.putObject("timeout_seconds").put("type", "integer")
                .put("description", "Timeout in seconds (default 30, max 300)");
        schema.putArray("required").add("command");
        return List.of(new ActionDescriptor(ACTION, "Execute a whitelisted command", schema,
                Set.of(ShellAuthorization.CAP_EXEC, ShellAuthorization.CAP_EXEC_UNLISTED)));
    }

    @Override
    public CapabilitySet capabilities(ActionRequest request) {
        return executor.authorize(request.stringArg("command")).capabilities();
    }

    @Override
    public String describe(ActionRequest request) {
        String command = request.stringArg("command");
        if (command == null) command = "";
        if (command.length() > PREVIEW_CHARS) command = command.substring(0, PREVIEW_CHARS) + "...";
        return "Execute: " + command;
    }

    @Override
    public ActionResult invoke(ActionRequest request, CallContext context) {
        JsonNode timeout = request.arguments().get("timeout_seconds");
        ShellResult result = executor.execute(request.stringArg("command"),
                timeout == null || timeout.isNull() ? null : timeout.asInt());
        return ActionResult.success(MAPPER.valueToTree(result));
    }
}
