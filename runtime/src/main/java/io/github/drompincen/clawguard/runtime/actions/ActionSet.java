package io.github.drompincen.clawguard.runtime.actions;

import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The gated actions available to one branch, keyed by action name.
 */
public class ActionSet {

    private final Map<String, ActionProvider> byAction;
    private final List<ActionDescriptor> descriptors;

    public ActionSet(Map<String, ActionProvider> byAction, List<ActionDescriptor> descriptors) {
        this.byAction = Collections.unmodifiableMap(new LinkedHashMap<>(byAction));
        this.descriptors = List.copyOf(descriptors);
    }

    public Optional<ActionProvider> find(String actionName) {
        return Optional.ofNullable(byAction.get(actionName));
    }

    public Set<String> names() {
        return byAction.keySet();
    }

    public List<ActionDescriptor> descriptors() {
        return descriptors;
    }

    public int size() {
        return byAction.size();
    }
}
