package net.spookly.hygate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.metrics.RequestOutcome;
import net.spookly.hygate.registry.HealthCheckResult;
import net.spookly.hygate.registry.HealthProbe;
import net.spookly.hygate.registry.ServiceDefinition;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import org.junit.jupiter.api.Test;

class HealthCheckServiceTest {
    @Test
    void roundFeedsHealthTracker() {
        StubProbe probe = new StubProbe();
        probe.statuses.put("users-2", 500);
        ServiceRegistry registry = registry(probe, "users-1", "users-2");
        InstanceHealthTracker tracker = new InstanceHealthTracker(1, 1);

        try (HealthCheckService service = new HealthCheckService(registry, tracker, 30, 4)) {
            List<HealthCheckResult> results = service.runOnce().join();

            assertEquals(2, results.size());
            assertTrue(tracker.isHealthy("users-1"));
            assertFalse(tracker.isHealthy("users-2"));
        }
    }

    @Test
    void concurrencyIsBounded() {
        StubProbe probe = new StubProbe();
        probe.deferred = true;
        ServiceRegistry registry = registry(probe, "a", "b", "c", "d", "e");

        try (HealthCheckService service = new HealthCheckService(registry, new InstanceHealthTracker(3, 2), 30, 2)) {
            CompletableFuture<List<HealthCheckResult>> round = service.runOnce();
            assertEquals(2, probe.pending.size());

            while (!round.isDone()) {
                probe.completeAll(200);
            }

            assertEquals(5, round.join().size());
            assertEquals(2, probe.maxInFlight.get());
        }
    }

    @Test
    void overlappingRoundIsSkipped() {
        StubProbe probe = new StubProbe();
        probe.deferred = true;
        ServiceRegistry registry = registry(probe, "a");

        try (HealthCheckService service = new HealthCheckService(registry, new InstanceHealthTracker(3, 2), 30, 2)) {
            CompletableFuture<List<HealthCheckResult>> first = service.runOnce();
            List<HealthCheckResult> skipped = service.runOnce().join();
            probe.completeAll(200);

            assertTrue(skipped.isEmpty());
            assertEquals(1, first.join().size());
        }
    }

    @Test
    void removedInstancesArePruned() {
        StubProbe probe = new StubProbe();
        probe.statuses.put("old", 500);
        ServiceRegistry registry = registry(probe, "old");
        InstanceHealthTracker tracker = new InstanceHealthTracker(1, 1);
        try (HealthCheckService service = new HealthCheckService(registry, tracker, 30, 2)) {
            service.runOnce().join();
            assertFalse(tracker.isHealthy("old"));

            registry.registerService(ServiceDefinition.of("users"),
                    List.of(new ServiceInstance("new", "users", "http://127.0.0.1:9000")));
            service.runOnce().join();

            assertTrue(tracker.isHealthy("old"));
            assertEquals(1, tracker.records().size());
        }
    }

    @Test
    void removedInstancesArePrunedFromBalancerState() {
        ServiceRegistry registry = registry(new StubProbe(), "old");
        InstanceHealthTracker tracker = new InstanceHealthTracker(3, 2);
        MetricsAggregator metrics = new MetricsAggregator();
        LoadBalancer loadBalancer = new LoadBalancer(registry, BalancingAlgorithm.LEAST_RESPONSE_TIME, tracker, null, metrics);
        loadBalancer.recordConnectionStart("old");
        loadBalancer.recordSuccess("old", 40);
        metrics.record("users", "old", RequestOutcome.SUCCESS, 40);

        try (HealthCheckService service = new HealthCheckService(registry, tracker, loadBalancer, 30, 2)) {
            registry.registerService(ServiceDefinition.of("users"),
                    List.of(new ServiceInstance("new", "users", "http://127.0.0.1:9000")));
            service.runOnce().join();
        }

        assertFalse(loadBalancer.connectionCounts().containsKey("old"));
        assertEquals(0, loadBalancer.averageResponseTime("old"));
        assertFalse(metrics.snapshot().instances().containsKey("old"));
        assertEquals(1, metrics.snapshot().services().get("users").requests());
    }

    private static ServiceRegistry registry(HealthProbe probe, String... ids) {
        ServiceRegistry registry = new ServiceRegistry(probe);
        ServiceInstance[] instances = new ServiceInstance[ids.length];
        for (int i = 0; i < ids.length; i++) {
            instances[i] = new ServiceInstance(ids[i], "users", "http://127.0.0.1:9000/" + ids[i]);
        }
        registry.registerService(ServiceDefinition.of("users"), List.of(instances));
        return registry;
    }

    private static final class StubProbe implements HealthProbe {
        private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
        private final Map<String, CompletableFuture<Integer>> pending = new ConcurrentHashMap<>();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private volatile boolean deferred;

        @Override
        public CompletableFuture<Integer> probe(URI healthUri, int timeoutMs) {
            String id = healthUri.getPath().split("/")[1];
            if (!deferred) {
                return CompletableFuture.completedFuture(statuses.getOrDefault(id, 200));
            }
            CompletableFuture<Integer> future = new CompletableFuture<>();
            pending.put(id, future);
            maxInFlight.accumulateAndGet(pending.size(), Math::max);
            return future;
        }

        private void completeAll(int status) {
            for (String id : List.copyOf(pending.keySet())) {
                CompletableFuture<Integer> future = pending.remove(id);
                if (future != null) {
                    future.complete(status);
                }
            }
        }
    }
}
