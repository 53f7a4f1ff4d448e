package io.github.drompincen.clawguard.tools;

/**
 * Process outcome. Non-zero exits are ordinary results: 127 command not found,
 * 126 permission denied, -1 timed out or interrupted.
 */
public record ShellResult(
        String stdout,
        String stderr,
        int exitCode,
        boolean truncated
) {
    public static final int EXIT_NOT_FOUND = 127;
    public static final int EXIT_PERMISSION_DENIED = 126;
    public static final int EXIT_TIMEOUT = -1;
}
