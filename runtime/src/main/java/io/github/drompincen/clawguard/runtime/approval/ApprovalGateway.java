package io.github.drompincen.clawguard.runtime.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.ApprovalDecision;
import io.github.drompincen.clawguard.protocol.api.ApprovalMode;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a NeedsApproval outcome into a decision, according to the run's approval mode.
 */
public class ApprovalGateway {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGateway.class);
    static final String REJECT_ALL_NOTE = "Rejected: approval mode is reject_all";

    private final ApprovalMode mode;
    private final ApprovalCallback callback;
    private final ApprovalSession session;
    private final Duration timeout;
    private final ExecutorService approvalExecutor;
    private final ObjectMapper mapper;

    public ApprovalGateway(ApprovalMode mode, ApprovalCallback callback, ApprovalSession session,
                           Duration timeout, ExecutorService approvalExecutor, ObjectMapper mapper) {
        if (mode == null) {
            throw new ConfigurationException("Approval mode is required");
        }
        if (mode == ApprovalMode.INTERACTIVE && callback == null) {
            throw new ConfigurationException(
                    "Approval mode is interactive but no approval callback is configured; "
                            + "register an ApprovalCallback or use approve_all / reject_all");
        }
        if (mode == ApprovalMode.INTERACTIVE && (timeout == null || timeout.isZero() || timeout.isNegative())) {
            throw new ConfigurationException("Interactive approval requires a positive timeout");
        }
        this.mode = mode;
        this.callback = callback;
        this.session = session;
        this.timeout = timeout;
        this.approvalExecutor = approvalExecutor;
        this.mapper = mapper;
    }

    public ApprovalMode mode() {
        return mode;
    }

    public ApprovalSession session() {
        return session;
    }

    public ApprovalDecision request(ActionRequest request, String description) {
        switch (mode) {
            case APPROVE_ALL:
                return ApprovalDecision.approve();
            case REJECT_ALL:
                log.info("Rejecting {} (reject_all)", request.name());
                return ApprovalDecision.deny(REJECT_ALL_NOTE);
            default:
                return interactive(request, description);
        }
    }

    private ApprovalDecision interactive(ActionRequest request, String description) {
        ApprovalCacheKey key = ApprovalCacheKey.of(request, mapper);
        Optional<ApprovalDecision> cached = session.lookup(key);
        if (cached.isPresent()) {
            log.debug("Session approval cache hit for {}", request.name());
            return cached.get();
        }

        ApprovalDecision decision = awaitDecision(request, description);
        if (session.remember(key, decision)) {
            log.debug("Remembered {} decision for {} for the rest of the run",
                    decision.approved() ? "approve" : "deny", request.name());
        }
        return decision;
    }

    private ApprovalDecision awaitDecision(ActionRequest request, String description) {
        Future<ApprovalDecision> future = approvalExecutor.submit(() -> callback.decide(request, description));
        try {
            ApprovalDecision decision = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (decision == null) {
                throw new ConfigurationException("Approval callback returned no decision for " + request.name());
            }
            log.info("Approval for {}: {}", request.name(), decision.approved() ? "approved" : "denied");
            return decision;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Approval for {} timed out after {}", request.name(), timeout);
            return ApprovalDecision.deny("Approval timed out after " + describe(timeout));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ApprovalDecision.deny("Interrupted while waiting for approval");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ConfigurationException("Approval callback failed for " + request.name(), cause);
        }
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }
}
