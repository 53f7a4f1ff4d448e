package io.github.drompincen.clawguard.runtime.errors;

public class SandboxViolationException extends ClawGuardException {

    public enum Kind {
        NOT_IN_SANDBOX,
        PATH_ESCAPE,
        READ_ONLY,
        SUFFIX_NOT_ALLOWED,
        TOO_LARGE
    }

    private final String path;
    private final Kind kind;

    public SandboxViolationException(String path, Kind kind, String message) {
        super(message);
        this.path = path;
        this.kind = kind;
    }

    public String getPath() { return path; }
    public Kind getKind() { return kind; }
}
