package io.github.drompincen.clawguard.runtime.call;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.BranchState;
import io.github.drompincen.clawguard.protocol.api.ChatMessage;
import io.github.drompincen.clawguard.protocol.event.EventType;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionResult;
import io.github.drompincen.clawguard.runtime.actions.ActionSet;
import io.github.drompincen.clawguard.runtime.actions.TaskDefinition;
import io.github.drompincen.clawguard.runtime.errors.ClawGuardException;
import io.github.drompincen.clawguard.runtime.errors.DepthExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The handle a task executor gets for one branch. Actions of a branch run one at a time in
 * request order; delegations fork child branches that share only the run-scoped {@link CallConfig}.
 */
public class CallContext {

    private static final Logger log = LoggerFactory.getLogger(CallContext.class);

    private final CallConfig config;
    private final CallFrame frame;
    private final ReentrantLock actionLock = new ReentrantLock();
    private volatile BranchState state = BranchState.CREATED;

    CallContext(CallConfig config, CallFrame frame) {
        this.config = config;
        this.frame = frame;
    }

    public String branchId() { return frame.getBranchId(); }
    public String parentBranchId() { return frame.getParentBranchId(); }
    public String taskName() { return frame.getTask().name(); }
    public String instructions() { return frame.getTask().instructions(); }
    public String prompt() { return frame.getPrompt(); }
    public int depth() { return frame.getDepth(); }
    public int maxDepth() { return config.maxDepth(); }
    public List<ChatMessage> messages() { return frame.getMessages(); }
    public List<ActionDescriptor> actions() { return frame.getActions().descriptors(); }
    public BranchState state() { return state; }

    /**
     * Invokes an action of this branch. Unknown names come back as a failed result listing what is
     * available; policy denials propagate unless the run reports them as results.
     */
    public ActionResult invoke(String actionName, JsonNode arguments) {
        actionLock.lock();
        try {
            ActionSet actions = frame.getActions();
            Optional<ActionProvider> provider = actions.find(actionName);
            if (provider.isEmpty()) {
                String error = "Unknown action '" + actionName + "'. Available actions: " + new TreeSet<>(actions.names());
                log.debug(error);
                return ActionResult.failure(error, ActionResult.UNKNOWN_ACTION);
            }

            ActionRequest request = new ActionRequest(actionName, arguments, frame.getBranchId());
            Map<String, Object> started = new LinkedHashMap<>();
            started.put("action", actionName);
            started.put("arguments", request.arguments());
            emit(EventType.ACTION_CALL_STARTED, started);

            ActionResult result;
            try {
                result = provider.get().invoke(request, this);
            } catch (RuntimeException e) {
                emit(EventType.ERROR, Map.of("action", actionName, "error", String.valueOf(e.getMessage())));
                throw e;
            }

            Map<String, Object> finished = new LinkedHashMap<>();
            finished.put("action", actionName);
            finished.put("success", result.success());
            if (result.error() != null) finished.put("error", result.error());
            if (result.errorType() != null) finished.put("errorType", result.errorType());
            emit(EventType.ACTION_CALL_RESULT, finished);
            return result;
        } finally {
            actionLock.unlock();
        }
    }

    public TaskResult delegate(String taskName, String prompt) {
        return delegate(config.registry().requireTask(taskName), prompt);
    }

    public TaskResult delegate(TaskDefinition target, String prompt) {
        if (frame.getDepth() >= config.maxDepth()) {
            log.warn("Delegation from {} to {} refused at depth {} (max {})",
                    taskName(), target.name(), frame.getDepth(), config.maxDepth());
            throw new DepthExceededException(frame.getDepth(), config.maxDepth(), taskName(), target.name());
        }
        ActionSet childActions = config.registry().resolve(target, config);
        CallContext child = new CallContext(config, frame.fork(target, childActions, prompt));
        log.info("Delegating {} -> {} (depth {})", taskName(), target.name(), child.depth());
        return child.run();
    }

    /**
     * Runs the delegations concurrently and waits for all of them. If any failed, the first
     * failure is rethrown after every sibling has finished; later ones are attached as suppressed.
     */
    public List<TaskResult> delegateAll(List<Delegation> delegations) {
        List<CompletableFuture<TaskResult>> futures = new ArrayList<>();
        for (Delegation delegation : delegations) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> delegate(delegation.target(), delegation.prompt()), config.branchExecutor()));
        }

        List<TaskResult> results = new ArrayList<>();
        RuntimeException failure = null;
        for (CompletableFuture<TaskResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (failure == null) {
                    failure = cause instanceof RuntimeException re ? re
                            : new ClawGuardException("Delegated branch failed", cause);
                } else {
                    failure.addSuppressed(cause);
                }
            }
        }
        if (failure != null) throw failure;
        return results;
    }

    public void recordUsage(long inputTokens, long outputTokens) {
        config.usage().add(new UsageRecord(frame.getBranchId(), taskName(), frame.getDepth(), inputTokens, outputTokens));
    }

    public void emit(EventType type, Object payload) {
        config.events().emit(frame, type, payload);
    }

    TaskResult run() {
        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        MDC.put("branchId", frame.getBranchId());
        MDC.put("task", taskName());
        MDC.put("depth", String.valueOf(frame.getDepth()));
        try {
            transition(BranchState.RUNNING);
            TaskResult result = config.taskExecutor().execute(this);
            if (result == null) {
                throw new ClawGuardException("Task executor returned no result for " + taskName());
            }
            config.messageLog().append(frame.getBranchId(), taskName(), frame.getDepth(), result.messages());
            transition(BranchState.COMPLETED);
            emit(EventType.FINAL_RESULT, Map.of("output", result.output() == null ? "" : result.output()));
            return result;
        } catch (DepthExceededException e) {
            boolean offending = e.getDepth() == frame.getDepth() && taskName().equals(e.getCaller());
            transition(offending ? BranchState.DEPTH_EXCEEDED : BranchState.FAILED);
            throw e;
        } catch (RuntimeException e) {
            transition(BranchState.FAILED);
            emit(EventType.ERROR, Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            if (previousMdc != null) {
                MDC.setContextMap(previousMdc);
            } else {
                MDC.clear();
            }
        }
    }

    private void transition(BranchState next) {
        BranchState previous = state;
        state = next;
        log.debug("Branch {} {} -> {}", frame.getBranchId(), previous, next);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", previous.name());
        payload.put("to", next.name());
        if (frame.getParentBranchId() != null) payload.put("parentBranchId", frame.getParentBranchId());
        emit(EventType.BRANCH_STATE_CHANGED, payload);
    }
}
