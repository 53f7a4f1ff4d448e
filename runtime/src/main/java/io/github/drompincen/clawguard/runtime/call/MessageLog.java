package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.protocol.api.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of the messages each branch produced, tagged with task and depth.
 */
public class MessageLog {

    public record Entry(String branchId, String taskName, int depth, ChatMessage message) {}

    private final List<Entry> entries = new ArrayList<>();

    public void append(String branchId, String taskName, int depth, List<ChatMessage> messages) {
        synchronized (entries) {
            for (ChatMessage message : messages) {
                entries.add(new Entry(branchId, taskName, depth, message));
            }
        }
    }

    public List<Entry> all() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public List<Entry> forTask(String taskName) {
        return all().stream().filter(e -> e.taskName().equals(taskName)).toList();
    }
}
