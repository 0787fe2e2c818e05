package net.spookly.hygate.routing;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Client-key to instance bindings for sticky sessions. Entries expire after the session TTL,
 * lazily on lookup and periodically once {@link #start()} is called.
 */
public final class SessionAffinityStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public SessionAffinityStore(long ttlMs, Clock clock) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("session ttl must be positive");
        }
        this.ttlMs = ttlMs;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Instance bound to the client key for a service, or null when absent or expired.
     */
    public String lookup(String serviceName, String clientKey) {
        String key = key(serviceName, clientKey);
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.instanceId;
    }

    /**
     * Bind the client key to an instance, restarting the TTL.
     */
    public void bind(String serviceName, String clientKey, String instanceId) {
        entries.put(key(serviceName, clientKey), new Entry(instanceId, clock.instant().plusMillis(ttlMs)));
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "hygate-session-expiry");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(1000L, ttlMs / 2);
        scheduler.scheduleAtFixedRate(this::purgeExpired, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private static String key(String serviceName, String clientKey) {
        return serviceName + '\u0000' + clientKey;
    }

    private static final class Entry {
        private final String instanceId;
        private final Instant expiresAt;

        private Entry(String instanceId, Instant expiresAt) {
            this.instanceId = instanceId;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
