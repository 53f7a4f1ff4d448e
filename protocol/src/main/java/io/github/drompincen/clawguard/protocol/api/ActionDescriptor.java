package io.github.drompincen.clawguard.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public record ActionDescriptor(
        String name,
        String description,
        JsonNode inputSchema,
        Set<String> capabilities
) {
    public ActionDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
