package io.github.drompincen.clawguard.runtime.policy;

import io.github.drompincen.clawguard.protocol.api.CapabilityRule;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Capability labels attached to one request. A provider may suggest the rule for a label it
 * reports; an explicit rule table entry always takes precedence over the suggestion.
 */
public record CapabilitySet(
        Set<String> labels,
        Map<String, CapabilityRule> suggestedRules
) {
    private static final CapabilitySet EMPTY = new CapabilitySet(Set.of(), Map.of());

    public CapabilitySet {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
        suggestedRules = suggestedRules == null ? Map.of() : Map.copyOf(suggestedRules);
    }

    public static CapabilitySet empty() {
        return EMPTY;
    }

    public static CapabilitySet of(String... labels) {
        return new CapabilitySet(Set.of(labels), Map.of());
    }

    public static CapabilitySet of(Collection<String> labels) {
        return new CapabilitySet(Set.copyOf(labels), Map.of());
    }

    public static CapabilitySet suggesting(String label, CapabilityRule rule) {
        return new CapabilitySet(Set.of(label), Map.of(label, rule));
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public boolean contains(String label) {
        return labels.contains(label);
    }

    public Optional<CapabilityRule> suggestedRule(String label) {
        return Optional.ofNullable(suggestedRules.get(label));
    }

    /** Labels in a stable order, for messages and approval prompts. */
    public Set<String> sortedLabels() {
        return new TreeSet<>(labels);
    }

    /**
     * Merges two sets. When both suggest a rule for the same label the more restrictive one wins.
     */
    public CapabilitySet union(CapabilitySet other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        Set<String> mergedLabels = new TreeSet<>(labels);
        mergedLabels.addAll(other.labels);
        Map<String, CapabilityRule> mergedRules = new HashMap<>(suggestedRules);
        other.suggestedRules.forEach((label, rule) ->
                mergedRules.merge(label, rule, (a, b) -> a.ordinal() <= b.ordinal() ? a : b));
        return new CapabilitySet(mergedLabels, mergedRules);
    }
}
