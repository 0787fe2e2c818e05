package net.spookly.hygate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import net.spookly.hygate.MutableClock;
import net.spookly.hygate.event.DispatchEvent;
import net.spookly.hygate.event.DispatchEventPublisher;
import net.spookly.hygate.event.DispatchEventType;
import org.junit.jupiter.api.Test;

class InstanceHealthTrackerTest {
    @Test
    void unknownInstancesAreHealthy() {
        InstanceHealthTracker tracker = new InstanceHealthTracker(3, 2);

        assertTrue(tracker.isHealthy("never-seen"));
        assertNull(tracker.record("never-seen"));
    }

    @Test
    void turnsUnhealthyExactlyAtFailureThreshold() {
        List<DispatchEvent> events = new ArrayList<>();
        InstanceHealthTracker tracker = tracker(events);

        tracker.recordFailure("users", "users-1", 10);
        tracker.recordFailure("users", "users-1", 10);
        assertTrue(tracker.isHealthy("users-1"));

        tracker.recordFailure("users", "users-1", 10);
        assertFalse(tracker.isHealthy("users-1"));
        assertEquals(1, events.size());
        assertEquals(DispatchEventType.INSTANCE_FAILED, events.get(0).type());
        assertEquals("users-1", events.get(0).instanceId());

        tracker.recordFailure("users", "users-1", 10);
        assertEquals(1, events.size());
        assertEquals(4, tracker.record("users-1").consecutiveFailures());
    }

    @Test
    void successResetsFailureStreak() {
        InstanceHealthTracker tracker = tracker(new ArrayList<>());

        tracker.recordFailure("users", "users-1", 10);
        tracker.recordFailure("users", "users-1", 10);
        tracker.recordSuccess("users", "users-1", 10);
        tracker.recordFailure("users", "users-1", 10);
        tracker.recordFailure("users", "users-1", 10);

        assertTrue(tracker.isHealthy("users-1"));
    }

    @Test
    void recoversExactlyAtRecoveryThreshold() {
        List<DispatchEvent> events = new ArrayList<>();
        InstanceHealthTracker tracker = tracker(events);
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure("users", "users-1", 10);
        }

        tracker.recordSuccess("users", "users-1", 10);
        assertFalse(tracker.isHealthy("users-1"));
        tracker.recordSuccess("users", "users-1", 10);

        assertTrue(tracker.isHealthy("users-1"));
        assertEquals(DispatchEventType.INSTANCE_RECOVERED, events.get(events.size() - 1).type());
        assertEquals(2, tracker.record("users-1").consecutiveSuccesses());
    }

    @Test
    void retainDropsRemovedInstances() {
        InstanceHealthTracker tracker = tracker(new ArrayList<>());
        tracker.recordFailure("users", "users-1", 10);
        tracker.recordFailure("users", "users-2", 10);

        tracker.retain(Set.of("users-2"));

        assertEquals(1, tracker.records().size());
        assertEquals("users-2", tracker.records().get(0).instanceId());
    }

    @Test
    void rejectsNonPositiveThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new InstanceHealthTracker(0, 2));
    }

    private static InstanceHealthTracker tracker(List<DispatchEvent> events) {
        return new InstanceHealthTracker(3, 2, new DispatchEventPublisher(events::add), new MutableClock());
    }
}
