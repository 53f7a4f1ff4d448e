package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.ApprovalMode;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.runtime.approval.ApprovalGateway;
import io.github.drompincen.clawguard.runtime.approval.ApprovalSession;
import io.github.drompincen.clawguard.runtime.approval.GatedActionProvider;
import io.github.drompincen.clawguard.runtime.approval.PermissionErrorResultProvider;
import io.github.drompincen.clawguard.runtime.call.CallConfig;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.call.EventEmitter;
import io.github.drompincen.clawguard.runtime.call.MessageLog;
import io.github.drompincen.clawguard.runtime.call.UsageCollector;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.policy.CapabilityResolver;
import io.github.drompincen.clawguard.runtime.policy.PolicyEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PolicyEngine engine = new PolicyEngine(new CapabilityResolver());
    private ActionRegistry registry;

    static class NamedProvider implements ActionProvider {
        private final String id;
        private final String[] actionNames;

        NamedProvider(String id, String... actionNames) {
            this.id = id;
            this.actionNames = actionNames;
        }

        @Override public String id() { return id; }
        @Override public List<ActionDescriptor> actions() {
            return java.util.Arrays.stream(actionNames)
                    .map(n -> new ActionDescriptor(n, n, null, Set.of()))
                    .toList();
        }
        @Override public ActionResult invoke(ActionRequest request, CallContext context) {
            return ActionResult.success(TextNode.valueOf(id));
        }
    }

    @BeforeEach
    void setUp() {
        registry = new ActionRegistry(engine);
    }

    private CallConfig config(boolean returnPermissionErrors, boolean delegationRequiresApproval) {
        ApprovalGateway gateway = new ApprovalGateway(ApprovalMode.APPROVE_ALL, null, new ApprovalSession(), null, null, mapper);
        return new CallConfig("run-1", 5, PolicyConfig.defaults(), gateway, returnPermissionErrors,
                delegationRequiresApproval, EventEmitter.none(mapper), new UsageCollector(), new MessageLog(),
                registry, context -> null, null);
    }

    @Test
    void factoryProvidersAreBuiltFreshForEveryResolution() {
        AtomicInteger created = new AtomicInteger();
        registry.registerFactory(new ActionProviderFactory() {
            @Override public String kind() { return "echo"; }
            @Override public ActionProvider create(JsonNode config, ProviderBuildContext context) {
                return new NamedProvider("echo-" + created.incrementAndGet(), "echo");
            }
        });
        TaskDefinition task = TaskDefinition.of("main", "do things").withProviders(ProviderSpec.of("echo", null));

        ActionSet first = registry.resolve(task, config(false, false));
        ActionSet second = registry.resolve(task, config(false, false));

        assertThat(created.get()).isEqualTo(2);
        assertThat(first.find("echo").get().id()).isEqualTo("echo-1");
        assertThat(second.find("echo").get().id()).isEqualTo("echo-2");
    }

    @Test
    void unknownKindIsConfigurationError() {
        TaskDefinition task = TaskDefinition.of("main", "x").withProviders(ProviderSpec.of("nope", null));

        assertThatThrownBy(() -> registry.resolve(task, config(false, false)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown provider kind 'nope'");
    }

    @Test
    void unknownDelegateListsKnownTasks() {
        registry.register(TaskDefinition.of("helper", "help"));
        TaskDefinition task = TaskDefinition.of("main", "x").withDelegates("missing");

        assertThatThrownBy(() -> registry.resolve(task, config(false, false)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing")
                .hasMessageContaining("helper");
    }

    @Test
    void providerReachableTwiceIsWrappedOnce() {
        NamedProvider shared = new NamedProvider("shared", "echo");
        TaskDefinition task = TaskDefinition.of("main", "x").withProvider(shared).withProvider(shared);

        ActionSet set = registry.resolve(task, config(false, false));

        assertThat(set.size()).isEqualTo(1);
        assertThat(((GatedActionProvider) set.find("echo").get()).inner()).isSameAs(shared);
    }

    @Test
    void alreadyGatedProviderIsRewrappedNotNested() {
        NamedProvider base = new NamedProvider("base", "echo");
        ActionSet parentSet = registry.resolve(TaskDefinition.of("parent", "x").withProvider(base), config(false, false));
        ActionProvider parentGated = parentSet.find("echo").get();

        ActionSet childSet = registry.resolve(TaskDefinition.of("child", "x").withProvider(parentGated), config(false, false));
        ActionProvider childGated = childSet.find("echo").get();

        assertThat(childGated).isNotSameAs(parentGated);
        assertThat(((GatedActionProvider) childGated).inner()).isSameAs(base);
        assertThat(WrappedActionProvider.unwrap(childGated)).isSameAs(base);
    }

    @Test
    void duplicateActionNamesAcrossProvidersAreRejected() {
        TaskDefinition task = TaskDefinition.of("main", "x")
                .withProvider(new NamedProvider("a", "echo"))
                .withProvider(new NamedProvider("b", "echo"));

        assertThatThrownBy(() -> registry.resolve(task, config(false, false)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate action 'echo'");
    }

    @Test
    void permissionErrorModeAddsOuterWrapper() {
        TaskDefinition task = TaskDefinition.of("main", "x").withProvider(new NamedProvider("a", "echo"));

        ActionSet set = registry.resolve(task, config(true, false));

        assertThat(set.find("echo").get()).isInstanceOf(PermissionErrorResultProvider.class);
    }

    @Test
    void delegatesBecomeActionsNamedAfterTarget() {
        registry.register(TaskDefinition.of("researcher", "research").withDescription("Find things out"));
        TaskDefinition task = TaskDefinition.of("main", "x").withDelegates("researcher");

        ActionSet set = registry.resolve(task, config(false, false));

        assertThat(set.names()).containsExactly("researcher");
        assertThat(set.descriptors().get(0).description()).isEqualTo("Find things out");
        assertThat(set.descriptors().get(0).capabilities()).containsExactly(DelegateActionProvider.CAPABILITY);
    }

    @Test
    void delegationApprovalFollowsTargetOverrideThenRunSetting() {
        registry.register(TaskDefinition.of("free", "x"));
        registry.register(TaskDefinition.of("guarded", "x").withCallsRequireApproval(true));
        TaskDefinition task = TaskDefinition.of("main", "x").withDelegates("free", "guarded");
        ActionRequest call = ActionRequest.of("free", mapper.createObjectNode());

        ActionSet set = registry.resolve(task, config(false, false));
        ActionProvider free = WrappedActionProvider.unwrap(set.find("free").get());
        ActionProvider guarded = WrappedActionProvider.unwrap(set.find("guarded").get());

        assertThat(free.capabilities(call).suggestedRule(DelegateActionProvider.CAPABILITY))
                .contains(CapabilityRule.PRE_APPROVED);
        assertThat(guarded.capabilities(call).suggestedRule(DelegateActionProvider.CAPABILITY))
                .contains(CapabilityRule.NEEDS_APPROVAL);

        ActionSet strict = registry.resolve(task, config(false, true));
        assertThat(WrappedActionProvider.unwrap(strict.find("free").get()).capabilities(call)
                .suggestedRule(DelegateActionProvider.CAPABILITY)).contains(CapabilityRule.NEEDS_APPROVAL);
    }

    @Test
    void buildContextExposesEarlierProviders() {
        registry.registerFactory(new ActionProviderFactory() {
            @Override public String kind() { return "first"; }
            @Override public ActionProvider create(JsonNode config, ProviderBuildContext context) {
                return new NamedProvider("first", "one");
            }
        });
        registry.registerFactory(new ActionProviderFactory() {
            @Override public String kind() { return "second"; }
            @Override public ActionProvider create(JsonNode config, ProviderBuildContext context) {
                String seen = context.find(NamedProvider.class).map(NamedProvider::id).orElse("none");
                return new NamedProvider("second-saw-" + seen, "two");
            }
        });
        TaskDefinition task = TaskDefinition.of("main", "x")
                .withProviders(ProviderSpec.of("first", null), ProviderSpec.of("second", null));

        ActionSet set = registry.resolve(task, config(false, false));

        assertThat(set.find("two").get().id()).isEqualTo("second-saw-first");
    }
}
