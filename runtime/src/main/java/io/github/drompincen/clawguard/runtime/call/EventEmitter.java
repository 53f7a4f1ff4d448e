package io.github.drompincen.clawguard.runtime.call;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawguard.protocol.event.EventType;
import io.github.drompincen.clawguard.protocol.event.RuntimeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-scoped event sink. Sequence numbers are unique within the run; a failing listener is
 * logged and never interrupts the branch that emitted the event.
 */
public class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final RuntimeEventListener listener;
    private final ObjectMapper mapper;
    private final AtomicLong seq = new AtomicLong();

    public EventEmitter(RuntimeEventListener listener, ObjectMapper mapper) {
        this.listener = listener;
        this.mapper = mapper;
    }

    public static EventEmitter none(ObjectMapper mapper) {
        return new EventEmitter(null, mapper);
    }

    public RuntimeEvent emit(CallFrame frame, EventType type, Object payload) {
        if (listener == null) return null;
        JsonNode body = mapper.valueToTree(payload == null ? Map.of() : payload);
        RuntimeEvent event = new RuntimeEvent(seq.incrementAndGet(), frame.getBranchId(),
                frame.getTask().name(), frame.getDepth(), type, body, Instant.now());
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on {} for branch {}: {}", type, frame.getBranchId(), e.getMessage());
        }
        return event;
    }
}
