package io.github.drompincen.clawguard.runtime.approval;

import io.github.drompincen.clawguard.protocol.api.ApprovalDecision;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped memory of decisions marked {@code remember=SESSION}. Concurrent stores for the
 * same key keep whichever write lands last.
 */
public class ApprovalSession {

    private final ConcurrentHashMap<ApprovalCacheKey, ApprovalDecision> decisions = new ConcurrentHashMap<>();

    public Optional<ApprovalDecision> lookup(ApprovalCacheKey key) {
        return Optional.ofNullable(decisions.get(key));
    }

    public boolean remember(ApprovalCacheKey key, ApprovalDecision decision) {
        if (decision.remember() != ApprovalDecision.Remember.SESSION) return false;
        decisions.put(key, decision);
        return true;
    }

    public int size() {
        return decisions.size();
    }
}
