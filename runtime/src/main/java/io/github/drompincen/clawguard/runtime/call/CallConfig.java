package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.protocol.api.PolicyConfig;
import io.github.drompincen.clawguard.runtime.actions.ActionRegistry;
import io.github.drompincen.clawguard.runtime.approval.ApprovalGateway;

import java.util.concurrent.ExecutorService;

/**
 * Settings and sinks shared read-only by every branch of one run.
 */
public record CallConfig(
        String runId,
        int maxDepth,
        PolicyConfig policy,
        ApprovalGateway gateway,
        boolean returnPermissionErrors,
        boolean delegationRequiresApproval,
        EventEmitter events,
        UsageCollector usage,
        MessageLog messageLog,
        ActionRegistry registry,
        TaskExecutor taskExecutor,
        ExecutorService branchExecutor
) {}
