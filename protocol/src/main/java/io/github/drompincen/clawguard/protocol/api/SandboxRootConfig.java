package io.github.drompincen.clawguard.protocol.api;

import java.util.List;

/**
 * One named root of a file sandbox. Suffixes are compared case-insensitively;
 * a {@code null} list allows every suffix and a {@code null} size applies no cap.
 */
public record SandboxRootConfig(
        String name,
        String root,
        Mode mode,
        List<String> suffixes,
        Long maxFileBytes,
        boolean readApproval,
        boolean writeApproval
) {
    public enum Mode {
        RO,
        RW
    }

    public SandboxRootConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Sandbox root name is required");
        if (name.contains("/") || name.contains(":")) {
            throw new IllegalArgumentException("Sandbox root name must not contain '/' or ':': " + name);
        }
        if (root == null || root.isBlank()) throw new IllegalArgumentException("Sandbox root path is required for " + name);
        if (mode == null) mode = Mode.RO;
        suffixes = suffixes == null ? null : List.copyOf(suffixes);
    }

    public static SandboxRootConfig readOnly(String name, String root) {
        return new SandboxRootConfig(name, root, Mode.RO, null, null, false, true);
    }

    public static SandboxRootConfig readWrite(String name, String root) {
        return new SandboxRootConfig(name, root, Mode.RW, null, null, false, true);
    }

    public boolean writable() {
        return mode == Mode.RW;
    }
}
