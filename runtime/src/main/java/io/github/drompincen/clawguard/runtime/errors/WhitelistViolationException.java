package io.github.drompincen.clawguard.runtime.errors;

/**
 * A command line was rejected by the executor whitelist before any process was started.
 */
public class WhitelistViolationException extends PolicyDeniedException {

    private final String command;

    public WhitelistViolationException(String command, String message) {
        super("shell", Kind.BLOCKED, message);
        this.command = command;
    }

    public String getCommand() { return command; }
}
