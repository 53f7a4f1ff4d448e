package io.github.drompincen.clawguard.runtime.call;

public record UsageRecord(
        String branchId,
        String taskName,
        int depth,
        long inputTokens,
        long outputTokens
) {
    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
