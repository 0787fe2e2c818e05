package net.spookly.hygate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import net.spookly.hygate.MutableClock;
import org.junit.jupiter.api.Test;

class SessionAffinityStoreTest {
    @Test
    void bindingsAreScopedPerService() {
        SessionAffinityStore store = new SessionAffinityStore(1000, new MutableClock());

        store.bind("users", "client", "users-1");
        store.bind("orders", "client", "orders-2");

        assertEquals("users-1", store.lookup("users", "client"));
        assertEquals("orders-2", store.lookup("orders", "client"));
        assertNull(store.lookup("billing", "client"));
    }

    @Test
    void rebindingRestartsTtl() {
        MutableClock clock = new MutableClock();
        SessionAffinityStore store = new SessionAffinityStore(1000, clock);
        store.bind("users", "client", "users-1");

        clock.advanceMillis(800);
        store.bind("users", "client", "users-1");
        clock.advanceMillis(800);

        assertEquals("users-1", store.lookup("users", "client"));
    }

    @Test
    void purgeRemovesExpiredEntries() {
        MutableClock clock = new MutableClock();
        SessionAffinityStore store = new SessionAffinityStore(1000, clock);
        store.bind("users", "a", "users-1");
        clock.advanceMillis(500);
        store.bind("users", "b", "users-2");
        clock.advanceMillis(500);

        assertEquals(1, store.purgeExpired());
        assertEquals(1, store.size());
        assertNull(store.lookup("users", "a"));
    }
}
