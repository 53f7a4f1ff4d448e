package io.github.drompincen.clawguard.runtime.actions;

import io.github.drompincen.clawguard.protocol.api.ActionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A delegation target: instructions for the task executor plus the providers and
 * sub-tasks it may use. {@code callsRequireApproval} overrides the run-wide setting
 * for calls into this task; {@code null} keeps the run-wide value.
 */
public record TaskDefinition(
        String name,
        String description,
        String instructions,
        List<ProviderSpec> providers,
        List<String> delegates,
        Boolean callsRequireApproval,
        Map<String, ActionPolicy> actionPolicies
) {
    public TaskDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Task name is required");
        providers = providers == null ? List.of() : List.copyOf(providers);
        delegates = delegates == null ? List.of() : List.copyOf(delegates);
        actionPolicies = actionPolicies == null ? Map.of() : Map.copyOf(actionPolicies);
        if (description == null) description = "Delegate to " + name;
    }

    public static TaskDefinition of(String name, String instructions) {
        return new TaskDefinition(name, null, instructions, List.of(), List.of(), null, Map.of());
    }

    public TaskDefinition withProviders(ProviderSpec... specs) {
        List<ProviderSpec> merged = new ArrayList<>(providers);
        merged.addAll(List.of(specs));
        return new TaskDefinition(name, description, instructions, merged, delegates, callsRequireApproval, actionPolicies);
    }

    public TaskDefinition withProvider(ActionProvider provider) {
        return withProviders(ProviderSpec.instance(provider));
    }

    public TaskDefinition withDelegates(String... names) {
        List<String> merged = new ArrayList<>(delegates);
        merged.addAll(List.of(names));
        return new TaskDefinition(name, description, instructions, providers, merged, callsRequireApproval, actionPolicies);
    }

    public TaskDefinition withCallsRequireApproval(Boolean required) {
        return new TaskDefinition(name, description, instructions, providers, delegates, required, actionPolicies);
    }

    public TaskDefinition withActionPolicies(Map<String, ActionPolicy> policies) {
        return new TaskDefinition(name, description, instructions, providers, delegates, callsRequireApproval, policies);
    }

    public TaskDefinition withDescription(String text) {
        return new TaskDefinition(name, text, instructions, providers, delegates, callsRequireApproval, actionPolicies);
    }
}
