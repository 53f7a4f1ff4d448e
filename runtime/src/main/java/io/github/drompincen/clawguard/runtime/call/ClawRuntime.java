package io.github.drompincen.clawguard.runtime.call;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawguard.protocol.api.ApprovalMode;
import io.github.drompincen.clawguard.runtime.actions.ActionRegistry;
import io.github.drompincen.clawguard.runtime.approval.ApprovalCallback;
import io.github.drompincen.clawguard.runtime.approval.ApprovalGateway;
import io.github.drompincen.clawguard.runtime.approval.ApprovalSession;
import io.github.drompincen.clawguard.runtime.config.ClawGuardProperties;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point: validates the setup once and hands out isolated runs.
 */
public class ClawRuntime {

    private static final Logger log = LoggerFactory.getLogger(ClawRuntime.class);

    private final ClawGuardProperties properties;
    private final ActionRegistry registry;
    private final TaskExecutor taskExecutor;
    private final ApprovalCallback approvalCallback;
    private final RuntimeEventListener eventListener;
    private final ObjectMapper mapper;

    public ClawRuntime(ClawGuardProperties properties, ActionRegistry registry, TaskExecutor taskExecutor,
                       ApprovalCallback approvalCallback, RuntimeEventListener eventListener, ObjectMapper mapper) {
        if (taskExecutor == null) {
            throw new ConfigurationException("A TaskExecutor is required");
        }
        if (properties.maxDepth() < 0) {
            throw new ConfigurationException("clawguard.max-depth must not be negative: " + properties.maxDepth());
        }
        Duration timeout = properties.approval().timeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("clawguard.approval.timeout must be positive: " + timeout);
        }
        if (properties.approval().mode() == ApprovalMode.INTERACTIVE && approvalCallback == null) {
            throw new ConfigurationException(
                    "clawguard.approval.mode is interactive but no ApprovalCallback is available");
        }
        this.properties = properties;
        this.registry = registry;
        this.taskExecutor = taskExecutor;
        this.approvalCallback = approvalCallback;
        this.eventListener = eventListener;
        this.mapper = mapper;
        log.info("ClawGuard runtime ready (approval={}, maxDepth={})",
                properties.approval().mode(), properties.maxDepth());
    }

    public ActionRegistry registry() {
        return registry;
    }

    public ClawGuardProperties properties() {
        return properties;
    }

    public Run startRun() {
        String runId = UUID.randomUUID().toString();
        ExecutorService approvalExecutor = Executors.newCachedThreadPool(daemonThreads("approval-" + shortId(runId)));
        ExecutorService branchExecutor = Executors.newCachedThreadPool(daemonThreads("branch-" + shortId(runId)));
        ApprovalGateway gateway = new ApprovalGateway(properties.approval().mode(), approvalCallback,
                new ApprovalSession(), properties.approval().timeout(), approvalExecutor, mapper);
        CallConfig config = new CallConfig(
                runId,
                properties.maxDepth(),
                properties.policy().toPolicyConfig(),
                gateway,
                properties.approval().returnPermissionErrors(),
                properties.delegation().callsRequireApproval(),
                new EventEmitter(eventListener, mapper),
                new UsageCollector(),
                new MessageLog(),
                registry,
                taskExecutor,
                branchExecutor);
        log.info("Started run {}", runId);
        return new Run(config, approvalExecutor);
    }

    private static String shortId(String runId) {
        return runId.substring(0, 8);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
