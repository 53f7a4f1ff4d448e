package io.github.drompincen.clawguard.runtime.policy;

import io.github.drompincen.clawguard.protocol.api.ActionPolicy;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Derives the capability labels of a request from the per-action config, the static
 * name-to-capability map and the provider's own report. Never mutates its inputs.
 */
@Component
public class CapabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(CapabilityResolver.class);

    public CapabilitySet resolve(ActionRequest request, PolicyConfig config) {
        return resolve(request, config, null);
    }

    public CapabilitySet resolve(ActionRequest request, PolicyConfig config, ActionProvider provider) {
        CapabilitySet result = CapabilitySet.empty();

        ActionPolicy actionPolicy = config.action(request.name());
        if (actionPolicy != null && !actionPolicy.capabilities().isEmpty()) {
            result = result.union(CapabilitySet.of(actionPolicy.capabilities()));
        }

        Set<String> mapped = config.capabilityMap().get(request.name());
        if (mapped != null && !mapped.isEmpty()) {
            result = result.union(CapabilitySet.of(mapped));
        }

        if (provider != null) {
            result = result.union(provider.capabilities(request));
        }

        log.debug("Resolved capabilities for {}: {}", request.name(), result.sortedLabels());
        return result;
    }
}
