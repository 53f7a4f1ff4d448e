package io.github.drompincen.clawguard.runtime.approval;

import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.ApprovalDecision;

/**
 * External responder for interactive approval. May block until a human answers.
 */
@FunctionalInterface
public interface ApprovalCallback {

    ApprovalDecision decide(ActionRequest request, String description);
}
