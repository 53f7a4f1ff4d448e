package io.github.drompincen.clawguard.protocol.api;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public record PolicyConfig(
        Map<String, ActionPolicy> actions,
        Map<String, CapabilityRule> capabilityRules,
        CapabilityRule defaultRule,
        Map<String, Set<String>> capabilityMap
) {
    public PolicyConfig {
        actions = actions == null ? Map.of() : Map.copyOf(actions);
        capabilityRules = capabilityRules == null ? Map.of() : Map.copyOf(capabilityRules);
        defaultRule = defaultRule == null ? CapabilityRule.NEEDS_APPROVAL : defaultRule;
        capabilityMap = capabilityMap == null ? Map.of() : Map.copyOf(capabilityMap);
    }

    /** Empty tables; every action needs approval. */
    public static PolicyConfig defaults() {
        return new PolicyConfig(Map.of(), Map.of(), CapabilityRule.NEEDS_APPROVAL, Map.of());
    }

    public ActionPolicy action(String name) {
        return actions.get(name);
    }

    public PolicyConfig withActionOverrides(Map<String, ActionPolicy> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<String, ActionPolicy> merged = new HashMap<>(actions);
        merged.putAll(overrides);
        return new PolicyConfig(merged, capabilityRules, defaultRule, capabilityMap);
    }

    public PolicyConfig withCapabilityRule(String capability, CapabilityRule rule) {
        Map<String, CapabilityRule> merged = new HashMap<>(capabilityRules);
        merged.put(capability, rule);
        return new PolicyConfig(actions, merged, defaultRule, capabilityMap);
    }
}
