package net.spookly.hygate.routing;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.metrics.RequestOutcome;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks one healthy instance per request and keeps the health, connection and latency feedback
 * that the selection algorithms read.
 */
public final class LoadBalancer {
    private static final Logger LOG = LoggerFactory.getLogger(LoadBalancer.class);

    private final ServiceRegistry registry;
    private final BalancingAlgorithm algorithm;
    private final InstanceHealthTracker healthTracker;
    private final ConnectionTracker connections = new ConnectionTracker();
    private final ResponseTimeTracker responseTimes = new ResponseTimeTracker();
    private final SessionAffinityStore sessions;
    private final MetricsAggregator metrics;
    private final Map<String, AtomicInteger> roundRobinCounters = new ConcurrentHashMap<>();

    /**
     * @param sessions sticky session store, or null when sticky sessions are disabled
     * @param metrics  aggregator receiving per-attempt outcomes, or null
     */
    public LoadBalancer(ServiceRegistry registry,
                        BalancingAlgorithm algorithm,
                        InstanceHealthTracker healthTracker,
                        SessionAffinityStore sessions,
                        MetricsAggregator metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.sessions = sessions;
        this.metrics = metrics;
    }

    public LoadBalancer(ServiceRegistry registry, BalancingAlgorithm algorithm, InstanceHealthTracker healthTracker) {
        this(registry, algorithm, healthTracker, null, null);
    }

    /**
     * Build a load balancer from the loadBalancer config section.
     */
    public static LoadBalancer fromConfig(HygateConfig config,
                                          ServiceRegistry registry,
                                          InstanceHealthTracker healthTracker,
                                          MetricsAggregator metrics,
                                          Clock clock) {
        HygateConfig.LoadBalancerConfig section = config.loadBalancer;
        BalancingAlgorithm algorithm = BalancingAlgorithm.fromConfig(section == null ? null : section.algorithm);
        SessionAffinityStore sessions = null;
        if (section != null && ConfigDefaults.isTrue(section.stickySession)) {
            sessions = new SessionAffinityStore(
                    ConfigDefaults.intOrDefault(section.sessionTimeoutMs, ConfigDefaults.LB_SESSION_TIMEOUT_MS), clock);
        }
        return new LoadBalancer(registry, algorithm, healthTracker, sessions, metrics);
    }

    /**
     * Select a healthy instance of the service, or null when none is eligible.
     *
     * @param clientKey client identity used by ip-hash and sticky sessions; may be null
     */
    public ServiceInstance selectInstance(String serviceName, String clientKey) {
        List<ServiceInstance> healthy = filterHealthy(registry.getInstances(serviceName));
        if (healthy.isEmpty()) {
            LOG.debug("No healthy instance for service {}", serviceName);
            return null;
        }
        boolean sticky = sessions != null && clientKey != null;
        if (sticky) {
            ServiceInstance pinned = pinnedInstance(serviceName, clientKey, healthy);
            if (pinned != null) {
                sessions.bind(serviceName, clientKey, pinned.id());
                return pinned;
            }
        }
        ServiceInstance selected = select(serviceName, clientKey, healthy);
        if (sticky) {
            sessions.bind(serviceName, clientKey, selected.id());
        }
        return selected;
    }

    public ServiceInstance selectInstance(String serviceName) {
        return selectInstance(serviceName, null);
    }

    /**
     * Record a completed attempt that reached the backend.
     */
    public void recordSuccess(String instanceId, long responseTimeMs) {
        String serviceName = serviceOf(instanceId);
        healthTracker.recordSuccess(serviceName, instanceId, responseTimeMs);
        responseTimes.record(instanceId, responseTimeMs);
        if (metrics != null) {
            metrics.recordAttempt(serviceName, instanceId, RequestOutcome.SUCCESS, responseTimeMs);
        }
    }

    /**
     * Record a failed attempt; counts toward the instance's consecutive-failure streak.
     */
    public void recordFailure(String instanceId, long responseTimeMs) {
        String serviceName = serviceOf(instanceId);
        healthTracker.recordFailure(serviceName, instanceId, responseTimeMs);
        responseTimes.record(instanceId, responseTimeMs);
        if (metrics != null) {
            metrics.recordAttempt(serviceName, instanceId, RequestOutcome.FAILURE, responseTimeMs);
        }
    }

    public void recordConnectionStart(String instanceId) {
        connections.opened(instanceId);
        if (metrics != null) {
            metrics.connectionOpened();
        }
    }

    public void recordConnectionEnd(String instanceId) {
        connections.closed(instanceId);
        if (metrics != null) {
            metrics.connectionClosed();
        }
    }

    public int connectionCount(String instanceId) {
        return connections.count(instanceId);
    }

    public Map<String, Integer> connectionCounts() {
        return connections.snapshot();
    }

    public double averageResponseTime(String instanceId) {
        return responseTimes.average(instanceId);
    }

    /**
     * One health record per registered instance; instances without outcomes report as healthy.
     */
    public List<InstanceHealthRecord> getInstanceHealth() {
        List<InstanceHealthRecord> records = new ArrayList<>();
        for (ServiceInstance instance : registry.getAllInstances()) {
            InstanceHealthRecord record = healthTracker.record(instance.id());
            records.add(record == null
                    ? InstanceHealthRecord.assumedHealthy(instance.id(), instance.serviceName())
                    : record);
        }
        return records;
    }

    /**
     * Drop health, connection, latency and per-instance metric state for instances that are no
     * longer registered.
     */
    public void retainInstances(Collection<String> knownInstanceIds) {
        healthTracker.retain(knownInstanceIds);
        connections.retain(knownInstanceIds);
        responseTimes.retain(knownInstanceIds);
        if (metrics != null) {
            metrics.retainInstances(knownInstanceIds);
        }
    }

    public BalancingAlgorithm algorithm() {
        return algorithm;
    }

    public SessionAffinityStore sessions() {
        return sessions;
    }

    private List<ServiceInstance> filterHealthy(List<ServiceInstance> instances) {
        List<ServiceInstance> healthy = new ArrayList<>(instances.size());
        for (ServiceInstance instance : instances) {
            if (healthTracker.isHealthy(instance.id())) {
                healthy.add(instance);
            }
        }
        return healthy;
    }

    private ServiceInstance pinnedInstance(String serviceName, String clientKey, List<ServiceInstance> healthy) {
        String instanceId = sessions.lookup(serviceName, clientKey);
        if (instanceId == null) {
            return null;
        }
        for (ServiceInstance instance : healthy) {
            if (instance.id().equals(instanceId)) {
                return instance;
            }
        }
        return null;
    }

    private ServiceInstance select(String serviceName, String clientKey, List<ServiceInstance> candidates) {
        switch (algorithm) {
            case WEIGHTED_ROUND_ROBIN:
                return selectRoundRobin(serviceName, expandByWeight(candidates));
            case LEAST_CONNECTIONS:
                return selectLeastConnections(candidates);
            case LEAST_RESPONSE_TIME:
                return selectLeastResponseTime(candidates);
            case IP_HASH:
                return selectByHash(clientKey, candidates);
            case RANDOM:
                return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
            case ROUND_ROBIN:
            default:
                return selectRoundRobin(serviceName, candidates);
        }
    }

    private ServiceInstance selectRoundRobin(String serviceName, List<ServiceInstance> candidates) {
        AtomicInteger counter = roundRobinCounters.computeIfAbsent(serviceName, key -> new AtomicInteger());
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return candidates.get(index);
    }

    private static List<ServiceInstance> expandByWeight(List<ServiceInstance> candidates) {
        List<ServiceInstance> expanded = new ArrayList<>();
        for (ServiceInstance instance : candidates) {
            for (int i = 0; i < instance.weight(); i++) {
                expanded.add(instance);
            }
        }
        return expanded;
    }

    // Strict comparisons keep the first instance in list order on ties.
    private ServiceInstance selectLeastConnections(List<ServiceInstance> candidates) {
        ServiceInstance best = candidates.get(0);
        int bestCount = connections.count(best.id());
        for (int i = 1; i < candidates.size(); i++) {
            ServiceInstance candidate = candidates.get(i);
            int count = connections.count(candidate.id());
            if (count < bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private ServiceInstance selectLeastResponseTime(List<ServiceInstance> candidates) {
        ServiceInstance best = candidates.get(0);
        double bestAverage = responseTimes.average(best.id());
        for (int i = 1; i < candidates.size(); i++) {
            ServiceInstance candidate = candidates.get(i);
            double average = responseTimes.average(candidate.id());
            if (average < bestAverage) {
                best = candidate;
                bestAverage = average;
            }
        }
        return best;
    }

    private static ServiceInstance selectByHash(String clientKey, List<ServiceInstance> candidates) {
        String key = clientKey == null ? "" : clientKey;
        return candidates.get(Math.floorMod(key.hashCode(), candidates.size()));
    }

    private String serviceOf(String instanceId) {
        ServiceInstance instance = registry.getInstance(instanceId);
        return instance == null ? null : instance.serviceName();
    }
}
