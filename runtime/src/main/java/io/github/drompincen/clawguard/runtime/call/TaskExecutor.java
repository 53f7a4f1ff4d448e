package io.github.drompincen.clawguard.runtime.call;

/**
 * Drives one branch: reads the instructions, prompt and history from the context, issues
 * actions through {@link CallContext#invoke} and returns the result with the updated history.
 */
@FunctionalInterface
public interface TaskExecutor {

    TaskResult execute(CallContext context);
}
