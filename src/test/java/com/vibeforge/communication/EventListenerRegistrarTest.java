package com.vibeforge.communication;

import com.vibeforge.core.event.Event;
import com.vibeforge.core.event.EventType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventListenerRegistrarTest {

    @Test
    void testRepeatedReadyRegistersOnce() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Object> received = new ArrayList<>();
        EventListenerRegistrar registrar =
                new EventListenerRegistrar(bus, List.of(event -> received.add(event.getPayload())));

        registrar.registerListeners();
        registrar.registerListeners();
        bus.publish(new Event(EventType.GENERATION_STEP, "test", "r1", "Analyzing data"));

        assertEquals(List.of("Analyzing data"), received);
    }

    @Test
    void testCloseDetachesListeners() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Object> received = new ArrayList<>();
        EventListenerRegistrar registrar =
                new EventListenerRegistrar(bus, List.of(event -> received.add(event.getPayload())));

        registrar.registerListeners();
        registrar.unregisterListeners();
        bus.publish(new Event(EventType.GENERATION_STEP, "test", "r1", "Analyzing data"));

        assertTrue(received.isEmpty());
    }
}
