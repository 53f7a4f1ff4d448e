package io.github.drompincen.clawguard.runtime.config;

import io.github.drompincen.clawguard.runtime.actions.ActionRegistry;
import io.github.drompincen.clawguard.runtime.approval.ApprovalCallback;
import io.github.drompincen.clawguard.runtime.call.ClawRuntime;
import io.github.drompincen.clawguard.runtime.call.RuntimeEventListener;
import io.github.drompincen.clawguard.runtime.call.TaskExecutor;
import io.github.drompincen.clawguard.runtime.policy.PolicyEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ClawGuardProperties.class)
@ComponentScan(basePackageClasses = {PolicyEngine.class, ActionRegistry.class})
public class RuntimeConfiguration {

    @Bean
    public ClawRuntime clawRuntime(ClawGuardProperties properties,
                                   ActionRegistry registry,
                                   TaskExecutor taskExecutor,
                                   ObjectProvider<ApprovalCallback> approvalCallback,
                                   ObjectProvider<RuntimeEventListener> eventListener) {
        return new ClawRuntime(properties, registry, taskExecutor,
                approvalCallback.getIfAvailable(), eventListener.getIfAvailable(), JsonMappers.create());
    }
}
