package io.github.drompincen.clawguard.runtime.call;

import io.github.drompincen.clawguard.protocol.event.RuntimeEvent;

@FunctionalInterface
public interface RuntimeEventListener {

    void onEvent(RuntimeEvent event);
}
