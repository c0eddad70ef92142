package com.vibeforge.communication;

import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventBusTest {

    @Test
    void testBrokenListenerDoesNotStopDelivery() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Object> received = new ArrayList<>();
        bus.subscribe(event -> { throw new IllegalStateException("listener bug"); });
        bus.subscribe(event -> received.add(event.getPayload()));

        bus.publish(new Event(EventType.GENERATION_STEP, "test", "r1", "Validating code"));

        assertEquals(List.of("Validating code"), received);
    }

    @Test
    void testUnsubscribe() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Event> received = new ArrayList<>();
        VibeEventListener listener = received::add;
        bus.subscribe(listener);
        bus.unsubscribe(listener);

        bus.publish(new Event(EventType.ARTIFACT_SAVED, "test", "r1", "abc-v1"));

        assertTrue(received.isEmpty());
    }
}
