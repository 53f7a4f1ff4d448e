package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Service provider interface for action providers built from configuration.
 * Implementations are discovered through {@link java.util.ServiceLoader}.
 */
public interface ActionProviderFactory {

    String kind();

    ActionProvider create(JsonNode config, ProviderBuildContext context);
}
