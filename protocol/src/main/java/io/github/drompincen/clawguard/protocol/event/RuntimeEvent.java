package io.github.drompincen.clawguard.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record RuntimeEvent(
        long seq,
        String branchId,
        String taskName,
        int depth,
        EventType type,
        JsonNode payload,
        Instant timestamp
) {}
