package io.github.drompincen.clawguard.runtime.call;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only usage sink shared by every branch of a run.
 */
public class UsageCollector {

    private final List<UsageRecord> records = new ArrayList<>();

    public void add(UsageRecord record) {
        synchronized (records) {
            records.add(record);
        }
    }

    public List<UsageRecord> all() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public long totalInputTokens() {
        return all().stream().mapToLong(UsageRecord::inputTokens).sum();
    }

    public long totalOutputTokens() {
        return all().stream().mapToLong(UsageRecord::outputTokens).sum();
    }
}
