package com.vibeforge.communication;

import com.vibeforge.core.event.Event;

public interface EventBus {

    void publish(Event event);

    void subscribe(VibeEventListener listener);

    void unsubscribe(VibeEventListener listener);
}
