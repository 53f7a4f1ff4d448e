package io.github.drompincen.clawguard.runtime.config;

import io.github.drompincen.clawguard.protocol.api.ApprovalMode;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.runtime.actions.ActionRegistry;
import io.github.drompincen.clawguard.runtime.call.ClawRuntime;
import io.github.drompincen.clawguard.runtime.call.TaskExecutor;
import io.github.drompincen.clawguard.runtime.call.TaskResult;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.policy.PolicyEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(RuntimeConfiguration.class)
            .withBean(TaskExecutor.class, () -> context -> TaskResult.of("ok", List.of()));

    @Test
    void defaultsBindWithoutProperties() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(ClawRuntime.class);
            assertThat(context).hasSingleBean(PolicyEngine.class);
            assertThat(context).hasSingleBean(ActionRegistry.class);

            ClawGuardProperties properties = context.getBean(ClawGuardProperties.class);
            assertThat(properties.maxDepth()).isEqualTo(5);
            assertThat(properties.approval().mode()).isEqualTo(ApprovalMode.APPROVE_ALL);
            assertThat(properties.approval().timeout()).isEqualTo(Duration.ofMinutes(5));
            assertThat(properties.approval().returnPermissionErrors()).isFalse();
            assertThat(properties.delegation().callsRequireApproval()).isFalse();
            assertThat(properties.policy().toPolicyConfig()).isEqualTo(PolicyConfig.defaults());
        });
    }

    @Test
    void policyTablesBindFromProperties() {
        runner.withPropertyValues(
                        "clawguard.max-depth=3",
                        "clawguard.approval.mode=reject-all",
                        "clawguard.approval.return-permission-errors=true",
                        "clawguard.policy.default-rule=pre-approved",
                        "clawguard.policy.capability-rules[process.exec.unlisted]=blocked",
                        "clawguard.policy.actions[write_file].blocked=true",
                        "clawguard.policy.actions[write_file].block-reason=frozen",
                        "clawguard.policy.capability-map.deploy=process.exec,net.egress")
                .run(context -> {
                    ClawGuardProperties properties = context.getBean(ClawGuardProperties.class);
                    PolicyConfig policy = properties.policy().toPolicyConfig();

                    assertThat(properties.maxDepth()).isEqualTo(3);
                    assertThat(properties.approval().mode()).isEqualTo(ApprovalMode.REJECT_ALL);
                    assertThat(properties.approval().returnPermissionErrors()).isTrue();
                    assertThat(policy.defaultRule()).isEqualTo(CapabilityRule.PRE_APPROVED);
                    assertThat(policy.capabilityRules()).containsEntry("process.exec.unlisted", CapabilityRule.BLOCKED);
                    assertThat(policy.action("write_file").blocked()).isTrue();
                    assertThat(policy.action("write_file").blockReason()).isEqualTo("frozen");
                    assertThat(policy.capabilityMap().get("deploy")).containsExactlyInAnyOrder("process.exec", "net.egress");
                });
    }

    @Test
    void zeroApprovalTimeoutFailsContextStartup() {
        runner.withPropertyValues("clawguard.approval.timeout=0s")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(ConfigurationException.class));
    }

    @Test
    void interactiveWithoutCallbackFailsContextStartup() {
        runner.withPropertyValues("clawguard.approval.mode=interactive")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(ConfigurationException.class));
    }
}
