package io.github.drompincen.clawguard.tools;

public record ReadResult(
        String content,
        boolean truncated,
        int totalChars,
        int offset,
        int charsRead
) {}
