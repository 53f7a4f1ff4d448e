package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Either a factory kind with its configuration, built fresh for every branch,
 * or a prebuilt provider instance shared by every branch that lists it.
 */
public record ProviderSpec(
        String kind,
        JsonNode config,
        ActionProvider instance
) {
    public static ProviderSpec of(String kind, JsonNode config) {
        return new ProviderSpec(kind, config == null ? JsonNodeFactory.instance.objectNode() : config, null);
    }

    public static ProviderSpec instance(ActionProvider provider) {
        return new ProviderSpec(null, null, provider);
    }

    public boolean isInstance() {
        return instance != null;
    }
}
