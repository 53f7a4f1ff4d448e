package io.github.drompincen.clawguard.runtime.errors;

/**
 * The policy blocked an action or an approver denied it.
 */
public class PolicyDeniedException extends ClawGuardException {

    public enum Kind {
        BLOCKED,
        DENIED
    }

    private final String actionName;
    private final Kind kind;

    public PolicyDeniedException(String actionName, Kind kind, String message) {
        super(message);
        this.actionName = actionName;
        this.kind = kind;
    }

    public static PolicyDeniedException blocked(String actionName, String reason) {
        return new PolicyDeniedException(actionName, Kind.BLOCKED,
                "Action '" + actionName + "' blocked: " + reason);
    }

    public static PolicyDeniedException denied(String actionName, String note) {
        String message = "Approval denied for action '" + actionName + "'";
        if (note != null && !note.isBlank()) message += ": " + note;
        return new PolicyDeniedException(actionName, Kind.DENIED, message);
    }

    public String getActionName() { return actionName; }
    public Kind getKind() { return kind; }
}
