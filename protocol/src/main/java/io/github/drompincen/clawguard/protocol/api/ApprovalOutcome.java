package io.github.drompincen.clawguard.protocol.api;

/**
 * Result of evaluating one request against the policy. Only {@link Status#BLOCKED} carries a reason.
 */
public record ApprovalOutcome(
        Status status,
        String reason
) {
    public enum Status {
        BLOCKED,
        PRE_APPROVED,
        NEEDS_APPROVAL
    }

    private static final ApprovalOutcome PRE_APPROVED = new ApprovalOutcome(Status.PRE_APPROVED, null);
    private static final ApprovalOutcome NEEDS_APPROVAL = new ApprovalOutcome(Status.NEEDS_APPROVAL, null);

    public static ApprovalOutcome blocked(String reason) {
        return new ApprovalOutcome(Status.BLOCKED, reason);
    }

    public static ApprovalOutcome preApproved() {
        return PRE_APPROVED;
    }

    public static ApprovalOutcome needingApproval() {
        return NEEDS_APPROVAL;
    }

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }

    public boolean isPreApproved() {
        return status == Status.PRE_APPROVED;
    }

    public boolean needsApproval() {
        return status == Status.NEEDS_APPROVAL;
    }
}
