package io.github.drompincen.clawguard.protocol.api;

public record ApprovalDecision(
        boolean approved,
        Remember remember,
        String note
) {
    public enum Remember {
        NONE,
        SESSION
    }

    public ApprovalDecision {
        if (remember == null) remember = Remember.NONE;
    }

    public static ApprovalDecision approve() {
        return new ApprovalDecision(true, Remember.NONE, null);
    }

    public static ApprovalDecision approveForSession() {
        return new ApprovalDecision(true, Remember.SESSION, null);
    }

    public static ApprovalDecision deny(String note) {
        return new ApprovalDecision(false, Remember.NONE, note);
    }
}
