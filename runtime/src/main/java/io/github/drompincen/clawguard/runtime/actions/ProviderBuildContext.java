package io.github.drompincen.clawguard.runtime.actions;

import java.util.List;
import java.util.Optional;

/**
 * Providers already built for the same task, in declaration order.
 */
public record ProviderBuildContext(
        String taskName,
        List<ActionProvider> built
) {
    public ProviderBuildContext {
        built = built == null ? List.of() : List.copyOf(built);
    }

    public <T> Optional<T> find(Class<T> type) {
        return built.stream().filter(type::isInstance).map(type::cast).findFirst();
    }
}
