package net.spookly.hygate.metrics;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-lifetime request counters. Writers swap immutable counter values per key, so readers
 * taking a snapshot never block them.
 */
public final class MetricsAggregator {
    private final AtomicReference<Counters> totals = new AtomicReference<>(Counters.EMPTY);
    private final Map<String, AtomicReference<Counters>> services = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<Counters>> instances = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<Counters>> attempts = new ConcurrentHashMap<>();
    private final Map<String, String> instanceServices = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> errorsByCode = new ConcurrentHashMap<>();
    private final AtomicLong activeConnections = new AtomicLong();
    private final Clock clock;

    public MetricsAggregator(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MetricsAggregator() {
        this(Clock.systemUTC());
    }

    /**
     * Record the final outcome of one client request.
     */
    public void record(String serviceName, String instanceId, RequestOutcome outcome, long latencyMs) {
        record(serviceName, instanceId, outcome, latencyMs, null);
    }

    /**
     * Record the final outcome of one client request together with the error code it failed with.
     */
    public void record(String serviceName, String instanceId, RequestOutcome outcome, long latencyMs, String errorCode) {
        totals.updateAndGet(current -> current.add(outcome, latencyMs));
        if (serviceName != null) {
            update(services, serviceName, outcome, latencyMs);
        }
        if (instanceId != null) {
            rememberService(instanceId, serviceName);
            update(instances, instanceId, outcome, latencyMs);
        }
        if (errorCode != null) {
            errorsByCode.computeIfAbsent(errorCode, key -> new LongAdder()).increment();
        }
    }

    /**
     * Record a single network attempt against an instance.
     */
    public void recordAttempt(String serviceName, String instanceId, RequestOutcome outcome, long latencyMs) {
        if (instanceId == null) {
            return;
        }
        rememberService(instanceId, serviceName);
        update(attempts, instanceId, outcome, latencyMs);
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public RequestMetricsSnapshot snapshot() {
        Counters total = totals.get();
        Map<String, ServiceMetrics> serviceSnapshot = new TreeMap<>();
        for (Map.Entry<String, AtomicReference<Counters>> entry : services.entrySet()) {
            Counters counters = entry.getValue().get();
            serviceSnapshot.put(entry.getKey(), new ServiceMetrics(entry.getKey(), counters.requests,
                    counters.successes, counters.failures, counters.averageMs));
        }
        Map<String, InstanceMetrics> instanceSnapshot = new TreeMap<>();
        for (String instanceId : instanceServices.keySet()) {
            Counters requests = current(instances, instanceId);
            Counters tried = current(attempts, instanceId);
            instanceSnapshot.put(instanceId, new InstanceMetrics(instanceId, instanceServices.get(instanceId),
                    requests.requests, requests.successes, requests.failures, requests.averageMs,
                    tried.requests, tried.failures, tried.averageMs));
        }
        Map<String, Long> errors = new TreeMap<>();
        for (Map.Entry<String, LongAdder> entry : errorsByCode.entrySet()) {
            errors.put(entry.getKey(), entry.getValue().sum());
        }
        return new RequestMetricsSnapshot(clock.instant(), total.requests, total.successes, total.failures,
                total.averageMs, activeConnections.get(),
                Collections.unmodifiableMap(serviceSnapshot),
                Collections.unmodifiableMap(instanceSnapshot),
                Collections.unmodifiableMap(errors));
    }

    /**
     * Clear all request counters. The active connection gauge reflects live state and is kept.
     */
    public void reset() {
        totals.set(Counters.EMPTY);
        services.clear();
        instances.clear();
        attempts.clear();
        instanceServices.clear();
        errorsByCode.clear();
    }

    /**
     * Forget per-instance counters of instances that are no longer registered. Totals and
     * per-service counters keep their history.
     */
    public void retainInstances(Collection<String> knownInstanceIds) {
        Set<String> known = new HashSet<>(knownInstanceIds);
        instanceServices.keySet().removeIf(id -> !known.contains(id));
        instances.keySet().removeIf(id -> !known.contains(id));
        attempts.keySet().removeIf(id -> !known.contains(id));
    }

    private void rememberService(String instanceId, String serviceName) {
        instanceServices.putIfAbsent(instanceId, serviceName == null ? "" : serviceName);
    }

    private static void update(Map<String, AtomicReference<Counters>> map,
                               String key,
                               RequestOutcome outcome,
                               long latencyMs) {
        map.computeIfAbsent(key, ignored -> new AtomicReference<>(Counters.EMPTY))
                .updateAndGet(current -> current.add(outcome, latencyMs));
    }

    private static Counters current(Map<String, AtomicReference<Counters>> map, String key) {
        AtomicReference<Counters> reference = map.get(key);
        return reference == null ? Counters.EMPTY : reference.get();
    }
}
