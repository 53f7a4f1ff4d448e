package io.github.drompincen.clawguard.runtime.actions;

import com.fasterxml.jackson.databind.JsonNode;

public record ActionResult(
        boolean success,
        JsonNode output,
        String error,
        String errorType
) {
    public static final String PERMISSION = "permission";
    public static final String SANDBOX_VIOLATION = "sandbox_violation";
    public static final String UNKNOWN_ACTION = "unknown_action";

    public static ActionResult success(JsonNode output) {
        return new ActionResult(true, output, null, null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, null, error, null);
    }

    public static ActionResult failure(String error, String errorType) {
        return new ActionResult(false, null, error, errorType);
    }

    public static ActionResult permissionDenied(String error) {
        return new ActionResult(false, null, error, PERMISSION);
    }
}
