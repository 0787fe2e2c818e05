package net.spookly.hygate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import net.spookly.hygate.MutableClock;
import net.spookly.hygate.registry.ServiceDefinition;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import org.junit.jupiter.api.Test;

class LoadBalancerTest {
    @Test
    void roundRobinCyclesThroughHealthyInstances() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1), instance("c", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN, new InstanceHealthTracker(3, 2));

        Map<String, Integer> counts = select(balancer, 9);

        assertEquals(Map.of("a", 3, "b", 3, "c", 3), counts);
        assertEquals("a", balancer.selectInstance("users").id());
    }

    @Test
    void weightedRoundRobinFollowsWeights() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 3));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.WEIGHTED_ROUND_ROBIN,
                new InstanceHealthTracker(3, 2));

        List<String> firstCycle = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            firstCycle.add(balancer.selectInstance("users").id());
        }
        Map<String, Integer> counts = select(balancer, 396);

        assertEquals(List.of("a", "b", "b", "b"), firstCycle);
        assertEquals(99, counts.get("a"));
        assertEquals(297, counts.get("b"));
    }

    @Test
    void leastConnectionsPicksIdlestInstance() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1), instance("c", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.LEAST_CONNECTIONS,
                new InstanceHealthTracker(3, 2));
        open(balancer, "a", 3);
        open(balancer, "b", 1);
        open(balancer, "c", 2);

        assertEquals("b", balancer.selectInstance("users").id());

        balancer.recordConnectionEnd("a");
        balancer.recordConnectionEnd("a");
        balancer.recordConnectionEnd("a");
        assertEquals("a", balancer.selectInstance("users").id());
        assertEquals(0, balancer.connectionCount("a"));
    }

    @Test
    void leastConnectionsTieGoesToFirstInstance() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.LEAST_CONNECTIONS,
                new InstanceHealthTracker(3, 2));

        assertEquals("a", balancer.selectInstance("users").id());
        assertEquals("a", balancer.selectInstance("users").id());
    }

    @Test
    void leastResponseTimePrefersFastestAverage() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.LEAST_RESPONSE_TIME,
                new InstanceHealthTracker(3, 2));
        balancer.recordSuccess("a", 120);
        balancer.recordSuccess("a", 80);
        balancer.recordSuccess("b", 40);

        assertEquals(100.0, balancer.averageResponseTime("a"));
        assertEquals("b", balancer.selectInstance("users").id());
    }

    @Test
    void ipHashIsStablePerClient() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1), instance("c", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.IP_HASH, new InstanceHealthTracker(3, 2));

        String first = balancer.selectInstance("users", "203.0.113.7").id();
        for (int i = 0; i < 10; i++) {
            assertEquals(first, balancer.selectInstance("users", "203.0.113.7").id());
        }
        int expected = Math.floorMod("203.0.113.7".hashCode(), 3);
        assertEquals(List.of("a", "b", "c").get(expected), first);
    }

    @Test
    void unhealthyInstancesAreSkipped() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        InstanceHealthTracker tracker = new InstanceHealthTracker(2, 1);
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN, tracker);

        balancer.recordFailure("a", 10);
        balancer.recordFailure("a", 10);

        for (int i = 0; i < 5; i++) {
            assertEquals("b", balancer.selectInstance("users").id());
        }
    }

    @Test
    void returnsNullWhenNoInstanceIsHealthy() {
        ServiceRegistry registry = registry(instance("a", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.RANDOM, new InstanceHealthTracker(1, 1));

        balancer.recordFailure("a", 5);

        assertNull(balancer.selectInstance("users"));
        assertNull(balancer.selectInstance("unknown"));
    }

    @Test
    void stickySessionsPinUntilExpiry() {
        MutableClock clock = new MutableClock();
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        SessionAffinityStore sessions = new SessionAffinityStore(1000, clock);
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN,
                new InstanceHealthTracker(3, 2), sessions, null);

        assertEquals("a", balancer.selectInstance("users", "client-1").id());
        assertEquals("b", balancer.selectInstance("users", "client-2").id());
        assertEquals("a", balancer.selectInstance("users", "client-1").id());

        clock.advanceMillis(1000);
        // The binding expired; round robin continues from where it stopped.
        assertEquals("a", balancer.selectInstance("users", "client-2").id());
        assertEquals("b", balancer.selectInstance("users", "client-1").id());
    }

    @Test
    void stickySessionMovesWhenPinnedInstanceFails() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        InstanceHealthTracker tracker = new InstanceHealthTracker(1, 1);
        SessionAffinityStore sessions = new SessionAffinityStore(60_000, new MutableClock());
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN, tracker, sessions, null);
        assertEquals("a", balancer.selectInstance("users", "client-1").id());

        balancer.recordFailure("a", 5);

        assertEquals("b", balancer.selectInstance("users", "client-1").id());
        assertEquals("b", sessions.lookup("users", "client-1"));
    }

    @Test
    void instanceHealthListsEveryRegisteredInstance() {
        ServiceRegistry registry = registry(instance("a", 1), instance("b", 1));
        LoadBalancer balancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN, new InstanceHealthTracker(1, 1));
        balancer.recordFailure("b", 7);

        List<InstanceHealthRecord> records = balancer.getInstanceHealth();

        assertEquals(2, records.size());
        assertTrue(records.get(0).healthy());
        assertEquals(0, records.get(0).consecutiveFailures());
        assertNotEquals(records.get(0).healthy(), records.get(1).healthy());
        assertEquals(7, records.get(1).lastResponseTimeMs());
    }

    @Test
    void unknownAlgorithmIsRejected() {
        assertEquals(BalancingAlgorithm.IP_HASH, BalancingAlgorithm.fromConfig("IP-Hash"));
        assertEquals(BalancingAlgorithm.ROUND_ROBIN, BalancingAlgorithm.fromConfig(null));
        assertThrows(IllegalArgumentException.class, () -> BalancingAlgorithm.fromConfig("fastest"));
    }

    private static Map<String, Integer> select(LoadBalancer balancer, int times) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < times; i++) {
            counts.merge(balancer.selectInstance("users").id(), 1, Integer::sum);
        }
        return counts;
    }

    private static void open(LoadBalancer balancer, String instanceId, int count) {
        for (int i = 0; i < count; i++) {
            balancer.recordConnectionStart(instanceId);
        }
    }

    private static ServiceInstance instance(String id, int weight) {
        return new ServiceInstance(id, "users", "http://127.0.0.1:9000/" + id, weight);
    }

    private static ServiceRegistry registry(ServiceInstance... instances) {
        ServiceRegistry registry = new ServiceRegistry((uri, timeoutMs) -> CompletableFuture.completedFuture(200));
        registry.registerService(ServiceDefinition.of("users"), List.of(instances));
        return registry;
    }
}
