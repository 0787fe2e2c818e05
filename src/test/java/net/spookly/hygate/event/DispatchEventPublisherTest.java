package net.spookly.hygate.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class DispatchEventPublisherTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void deliversToEveryListenerInOrder() {
        List<String> received = new ArrayList<>();
        DispatchEventPublisher publisher = new DispatchEventPublisher(
                event -> received.add("first:" + event.type()),
                event -> received.add("second:" + event.type()));

        publisher.publish(DispatchEvent.forService(DispatchEventType.SERVICE_REGISTERED, "orders", "2 instances", NOW));

        assertEquals(List.of("first:SERVICE_REGISTERED", "second:SERVICE_REGISTERED"), received);
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<DispatchEvent> received = new ArrayList<>();
        DispatchEventPublisher publisher = new DispatchEventPublisher();
        publisher.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        publisher.subscribe(received::add);

        publisher.publish(DispatchEvent.forInstance(DispatchEventType.INSTANCE_FAILED, "orders", "orders-1", null, NOW));

        assertEquals(1, received.size());
        assertEquals("orders-1", received.get(0).instanceId());
    }

    @Test
    void unsubscribedListenersStopReceiving() {
        List<DispatchEvent> received = new ArrayList<>();
        DispatchEventListener listener = received::add;
        DispatchEventPublisher publisher = new DispatchEventPublisher(listener);

        publisher.unsubscribe(listener);
        publisher.publish(DispatchEvent.forService(DispatchEventType.CIRCUIT_OPENED, "orders", null, NOW));

        assertTrue(received.isEmpty());
        assertEquals(0, publisher.listenerCount());
    }

    @Test
    void auditLineSkipsNullFields() {
        String line = AuditLogListener.format(
                DispatchEvent.forService(DispatchEventType.CIRCUIT_CLOSED, "payments", null, NOW));

        assertEquals("dispatch_event type=CIRCUIT_CLOSED service=payments timestamp=2026-01-01T00:00:00Z", line);
    }
}
