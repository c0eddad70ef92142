package com.vibeforge.communication;

import com.vibeforge.core.event.Event;

@FunctionalInterface
public interface VibeEventListener {

    void onEvent(Event event);
}
