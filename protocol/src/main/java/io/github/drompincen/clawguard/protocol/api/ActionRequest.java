package io.github.drompincen.clawguard.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public record ActionRequest(
        String name,
        JsonNode arguments,
        String branchId
) {
    public ActionRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name is required");
        }
        if (arguments == null || arguments.isNull()) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
    }

    public static ActionRequest of(String name, JsonNode arguments) {
        return new ActionRequest(name, arguments, null);
    }

    public String stringArg(String field) {
        JsonNode value = arguments.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
