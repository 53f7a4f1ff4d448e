package io.github.drompincen.clawguard.runtime.actions;

import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.runtime.approval.GatedActionProvider;
import io.github.drompincen.clawguard.runtime.approval.PermissionErrorResultProvider;
import io.github.drompincen.clawguard.runtime.call.CallConfig;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.policy.PolicyEngine;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds provider factories and task definitions, and builds the gated action set of a branch.
 */
@Component
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionProviderFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, TaskDefinition> tasks = new ConcurrentHashMap<>();
    private final PolicyEngine engine;

    public ActionRegistry(PolicyEngine engine) {
        this.engine = engine;
    }

    @PostConstruct
    public void loadFactories() {
        ServiceLoader<ActionProviderFactory> loader = ServiceLoader.load(ActionProviderFactory.class);
        for (ActionProviderFactory factory : loader) {
            registerFactory(factory);
        }
        log.info("Loaded {} action provider factories via SPI", factories.size());
    }

    public void registerFactory(ActionProviderFactory factory) {
        factories.put(factory.kind(), factory);
        log.debug("Registered provider factory: {}", factory.kind());
    }

    public void register(TaskDefinition task) {
        tasks.put(task.name(), task);
        log.debug("Registered task: {}", task.name());
    }

    public Optional<TaskDefinition> task(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public TaskDefinition requireTask(String name) {
        return task(name).orElseThrow(() -> new ConfigurationException(
                "Unknown task '" + name + "'. Known tasks: " + new TreeSet<>(tasks.keySet())));
    }

    public Collection<TaskDefinition> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Collection<String> factoryKinds() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Builds a fresh action set for a branch running {@code task}. Every provider is wrapped once
     * per call with the run's policy and gateway; providers that arrive already gated are unwrapped
     * first so a child never inherits a parent's wrapping.
     */
    public ActionSet resolve(TaskDefinition task, CallConfig config) {
        PolicyConfig policy = config.policy().withActionOverrides(task.actionPolicies());
        List<ActionProvider> providers = instantiate(task);
        for (String delegate : task.delegates()) {
            TaskDefinition target = requireTask(delegate);
            boolean requiresApproval = target.callsRequireApproval() != null
                    ? target.callsRequireApproval() : config.delegationRequiresApproval();
            providers.add(new DelegateActionProvider(target, requiresApproval));
        }

        Map<ActionProvider, ActionProvider> wrapped = new IdentityHashMap<>();
        Map<String, ActionProvider> byAction = new LinkedHashMap<>();
        List<ActionDescriptor> descriptors = new ArrayList<>();
        for (ActionProvider provider : providers) {
            ActionProvider base = WrappedActionProvider.unwrap(provider);
            if (wrapped.containsKey(base)) {
                log.debug("Provider {} already wrapped for task {}", base.id(), task.name());
                continue;
            }
            ActionProvider gated = gate(base, policy, config);
            wrapped.put(base, gated);
            for (ActionDescriptor descriptor : base.actions()) {
                ActionProvider previous = byAction.putIfAbsent(descriptor.name(), gated);
                if (previous != null) {
                    throw new ConfigurationException("Duplicate action '" + descriptor.name() + "' in task '"
                            + task.name() + "' (providers " + previous.id() + " and " + base.id() + ")");
                }
                descriptors.add(descriptor);
            }
        }
        log.debug("Resolved {} actions for task {}", byAction.size(), task.name());
        return new ActionSet(byAction, descriptors);
    }

    private ActionProvider gate(ActionProvider base, PolicyConfig policy, CallConfig config) {
        ActionProvider gated = new GatedActionProvider(base, engine, policy, config.gateway());
        return config.returnPermissionErrors() ? new PermissionErrorResultProvider(gated) : gated;
    }

    private List<ActionProvider> instantiate(TaskDefinition task) {
        List<ActionProvider> built = new ArrayList<>();
        for (ProviderSpec spec : task.providers()) {
            if (spec.isInstance()) {
                built.add(spec.instance());
                continue;
            }
            ActionProviderFactory factory = factories.get(spec.kind());
            if (factory == null) {
                throw new ConfigurationException("Unknown provider kind '" + spec.kind() + "' in task '"
                        + task.name() + "'. Known kinds: " + factoryKinds());
            }
            built.add(factory.create(spec.config(), new ProviderBuildContext(task.name(), built)));
        }
        return built;
    }
}
