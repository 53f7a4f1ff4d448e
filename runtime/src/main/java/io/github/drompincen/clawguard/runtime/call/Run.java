package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.protocol.api.ChatMessage;
import io.github.drompincen.clawguard.protocol.event.EventType;
import io.github.drompincen.clawguard.runtime.actions.ActionSet;
import io.github.drompincen.clawguard.runtime.actions.TaskDefinition;
import io.github.drompincen.clawguard.runtime.approval.ApprovalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * One top-level run. Owns the approval session cache and the telemetry sinks; the depth-0
 * history carries over between sequential calls.
 */
public class Run implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Run.class);

    private final CallConfig config;
    private final ExecutorService approvalExecutor;
    private List<ChatMessage> history = new ArrayList<>();

    Run(CallConfig config, ExecutorService approvalExecutor) {
        this.config = config;
        this.approvalExecutor = approvalExecutor;
    }

    public String id() {
        return config.runId();
    }

    public TaskResult call(String taskName, String prompt) {
        return call(config.registry().requireTask(taskName), prompt);
    }

    public synchronized TaskResult call(TaskDefinition task, String prompt) {
        log.info("Run {} calling {}", config.runId(), task.name());
        ActionSet actions = config.registry().resolve(task, config);
        CallContext context = new CallContext(config, CallFrame.root(task, actions, prompt, history));
        context.emit(EventType.USER_MESSAGE, Map.of("prompt", prompt == null ? "" : prompt));
        TaskResult result = context.run();
        history = new ArrayList<>(result.messages());
        return result;
    }

    public synchronized List<ChatMessage> history() {
        return List.copyOf(history);
    }

    public UsageCollector usage() {
        return config.usage();
    }

    public MessageLog messageLog() {
        return config.messageLog();
    }

    public ApprovalSession approvalSession() {
        return config.gateway().session();
    }

    CallConfig config() {
        return config;
    }

    @Override
    public void close() {
        config.branchExecutor().shutdownNow();
        approvalExecutor.shutdownNow();
        log.info("Run {} closed", config.runId());
    }
}
