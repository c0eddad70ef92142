package com.vibeforge.communication;

import com.vibeforge.core.event.Event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process bus. {@link #publish} returns after every listener ran,
 * so events from one request reach listeners in emission order.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<VibeEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (VibeEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                // a broken listener must not abort the request that emitted the event
                log.warn("[EventBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event, e.getMessage());
            }
        }
    }

    @Override
    public void subscribe(VibeEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(VibeEventListener listener) {
        listeners.remove(listener);
    }
}
