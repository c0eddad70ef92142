package com.vibeforge.communication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Subscribes every {@link VibeEventListener} bean once the application is ready,
 * and detaches them again when the context closes. Registration happens once
 * per context even if the ready event is delivered more than once.
 */
@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final EventBus                eventBus;
    private final List<VibeEventListener> listeners;

    private boolean registered = false;

    public EventListenerRegistrar(EventBus eventBus, List<VibeEventListener> listeners) {
        this.eventBus  = eventBus;
        this.listeners = List.copyOf(listeners);
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void registerListeners() {
        if (registered) return;
        listeners.forEach(eventBus::subscribe);
        registered = true;
        log.info("[EventListenerRegistrar] Subscribed {} listener(s): {}", listeners.size(), names());
    }

    @EventListener(ContextClosedEvent.class)
    public synchronized void unregisterListeners() {
        if (!registered) return;
        listeners.forEach(eventBus::unsubscribe);
        registered = false;
        log.info("[EventListenerRegistrar] Unsubscribed {} listener(s)", listeners.size());
    }

    private String names() {
        return listeners.stream()
                .map(l -> l.getClass().getSimpleName())
                .collect(Collectors.joining(", "));
    }
}
