package com.vibeforge.communication;

import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Mirrors progress events into the application log. Chunks only at debug. */
@Component
public class ProgressLogListener implements VibeEventListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogListener.class);

    @Override
    public void onEvent(Event event) {
        if (event.getType() == EventType.GENERATION_CHUNK) {
            log.debug("[Progress] {} chunk ({} chars)", event.getRequestId(),
                    String.valueOf(event.getPayload()).length());
            return;
        }
        if (event.getType() == EventType.GENERATION_ERROR) {
            log.warn("[Progress] {} {}: {}", event.getRequestId(), event.getType(), event.getPayload());
            return;
        }
        log.info("[Progress] {} {}: {}", event.getRequestId(), event.getType(), event.getPayload());
    }
}
