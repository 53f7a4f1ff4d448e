package io.github.drompincen.clawguard.runtime.call;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.clawguard.protocol.api.ChatMessage;

import java.util.List;

public record TaskResult(
        JsonNode output,
        List<ChatMessage> messages
) {
    public TaskResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static TaskResult of(String text, List<ChatMessage> messages) {
        return new TaskResult(TextNode.valueOf(text), messages);
    }

    public String outputText() {
        return output == null || output.isNull() ? null : output.isTextual() ? output.asText() : output.toString();
    }
}
