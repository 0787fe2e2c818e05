package net.spookly.hygate.routing;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Open upstream connection count per instance, never below zero.
 */
public final class ConnectionTracker {
    private final Map<String, AtomicInteger> open = new ConcurrentHashMap<>();

    public int opened(String instanceId) {
        return counter(instanceId).incrementAndGet();
    }

    public int closed(String instanceId) {
        return counter(instanceId).updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public int count(String instanceId) {
        AtomicInteger counter = instanceId == null ? null : open.get(instanceId);
        return counter == null ? 0 : counter.get();
    }

    public Map<String, Integer> snapshot() {
        Map<String, Integer> snapshot = new TreeMap<>();
        for (Map.Entry<String, AtomicInteger> entry : open.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().get());
        }
        return snapshot;
    }

    public void retain(Collection<String> knownInstanceIds) {
        Set<String> known = new HashSet<>(knownInstanceIds);
        open.keySet().removeIf(id -> !known.contains(id));
    }

    private AtomicInteger counter(String instanceId) {
        return open.computeIfAbsent(instanceId, key -> new AtomicInteger());
    }
}
