package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.protocol.api.ChatMessage;
import io.github.drompincen.clawguard.runtime.actions.ActionSet;
import io.github.drompincen.clawguard.runtime.actions.TaskDefinition;

import java.util.List;
import java.util.UUID;

/**
 * Branch-owned state. Frames are never changed in place: a delegation forks a new frame one
 * level deeper with an empty history.
 */
public class CallFrame {

    private final String branchId;
    private final String parentBranchId;
    private final TaskDefinition task;
    private final ActionSet actions;
    private final int depth;
    private final String prompt;
    private final List<ChatMessage> messages;

    private CallFrame(String branchId, String parentBranchId, TaskDefinition task, ActionSet actions,
                      int depth, String prompt, List<ChatMessage> messages) {
        this.branchId = branchId;
        this.parentBranchId = parentBranchId;
        this.task = task;
        this.actions = actions;
        this.depth = depth;
        this.prompt = prompt;
        this.messages = List.copyOf(messages);
    }

    public static CallFrame root(TaskDefinition task, ActionSet actions, String prompt, List<ChatMessage> history) {
        return new CallFrame(newBranchId(), null, task, actions, 0, prompt,
                history == null ? List.of() : history);
    }

    public CallFrame fork(TaskDefinition target, ActionSet childActions, String childPrompt) {
        return new CallFrame(newBranchId(), branchId, target, childActions, depth + 1, childPrompt, List.of());
    }

    private static String newBranchId() {
        return UUID.randomUUID().toString();
    }

    public String getBranchId() { return branchId; }
    public String getParentBranchId() { return parentBranchId; }
    public TaskDefinition getTask() { return task; }
    public ActionSet getActions() { return actions; }
    public int getDepth() { return depth; }
    public String getPrompt() { return prompt; }
    public List<ChatMessage> getMessages() { return messages; }
}
