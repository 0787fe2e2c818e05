package net.spookly.hygate.proxy;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.hygate.registry.RateLimit;
import net.spookly.hygate.registry.Route;

/**
 * Fixed-window request limit per route and client key.
 */
public final class RouteRateLimiter {
    private static final int PURGE_THRESHOLD = 10_000;

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RouteRateLimiter(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Count a request against the route's limit. Routes without a limit always pass.
     */
    public boolean tryAcquire(Route route, String clientKey) {
        RateLimit limit = route == null ? null : route.rateLimit();
        if (limit == null) {
            return true;
        }
        long now = clock.millis();
        if (windows.size() > PURGE_THRESHOLD) {
            purgeExpired(now);
        }
        String key = route.pathPattern() + '\u0000' + (clientKey == null ? "" : clientKey);
        Window window = windows.computeIfAbsent(key, ignored -> new Window(now, limit.windowMs()));
        synchronized (window) {
            window.windowMs = limit.windowMs();
            if (now - window.windowStart >= window.windowMs) {
                window.windowStart = now;
                window.count = 0;
            }
            if (window.count >= limit.maxRequests()) {
                return false;
            }
            window.count++;
        }
        return true;
    }

    int trackedWindows() {
        return windows.size();
    }

    // Each window expires on its own route's length.
    void purgeExpired(long now) {
        windows.values().removeIf(window -> {
            synchronized (window) {
                return now - window.windowStart >= window.windowMs;
            }
        });
    }

    private static final class Window {
        private long windowStart;
        private long windowMs;
        private int count;

        private Window(long windowStart, long windowMs) {
            this.windowStart = windowStart;
            this.windowMs = windowMs;
        }
    }
}
