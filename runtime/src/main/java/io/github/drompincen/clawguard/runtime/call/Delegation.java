package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.runtime.actions.TaskDefinition;

public record Delegation(
        TaskDefinition target,
        String prompt
) {}
