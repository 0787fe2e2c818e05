package net.spookly.hygate.routing;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.event.DispatchEvent;
import net.spookly.hygate.event.DispatchEventPublisher;
import net.spookly.hygate.event.DispatchEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive success/failure streaks per instance, fed by both request outcomes and health checks.
 * An instance turns unhealthy on the {@code failureThreshold}-th consecutive failure and healthy
 * again on the {@code recoveryThreshold}-th consecutive success. Instances without a record are healthy.
 */
public final class InstanceHealthTracker {
    private static final Logger LOG = LoggerFactory.getLogger(InstanceHealthTracker.class);

    private final Map<String, HealthState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final int recoveryThreshold;
    private final DispatchEventPublisher events;
    private final Clock clock;

    public InstanceHealthTracker(int failureThreshold, int recoveryThreshold, DispatchEventPublisher events, Clock clock) {
        if (failureThreshold < 1 || recoveryThreshold < 1) {
            throw new IllegalArgumentException("health thresholds must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryThreshold = recoveryThreshold;
        this.events = events == null ? new DispatchEventPublisher() : events;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public InstanceHealthTracker(int failureThreshold, int recoveryThreshold) {
        this(failureThreshold, recoveryThreshold, new DispatchEventPublisher(), Clock.systemUTC());
    }

    public static InstanceHealthTracker fromConfig(HygateConfig config, DispatchEventPublisher events, Clock clock) {
        HygateConfig.LoadBalancerConfig section = config.loadBalancer == null
                ? new HygateConfig.LoadBalancerConfig()
                : config.loadBalancer;
        return new InstanceHealthTracker(
                ConfigDefaults.intOrDefault(section.failureThreshold, ConfigDefaults.LB_FAILURE_THRESHOLD),
                ConfigDefaults.intOrDefault(section.recoveryThreshold, ConfigDefaults.LB_RECOVERY_THRESHOLD),
                events,
                clock);
    }

    public void recordSuccess(String serviceName, String instanceId, long responseTimeMs) {
        update(serviceName, instanceId, responseTimeMs, false);
    }

    public void recordFailure(String serviceName, String instanceId, long responseTimeMs) {
        update(serviceName, instanceId, responseTimeMs, true);
    }

    public boolean isHealthy(String instanceId) {
        HealthState state = instanceId == null ? null : states.get(instanceId);
        return state == null || state.healthy;
    }

    /**
     * Current record for an instance, or null when nothing was recorded for it yet.
     */
    public InstanceHealthRecord record(String instanceId) {
        HealthState state = instanceId == null ? null : states.get(instanceId);
        if (state == null) {
            return null;
        }
        synchronized (state) {
            return state.snapshot(instanceId);
        }
    }

    public List<InstanceHealthRecord> records() {
        List<InstanceHealthRecord> records = new ArrayList<>();
        for (String instanceId : states.keySet()) {
            InstanceHealthRecord record = record(instanceId);
            if (record != null) {
                records.add(record);
            }
        }
        records.sort(Comparator.comparing(InstanceHealthRecord::instanceId));
        return records;
    }

    /**
     * Drop records for instances that are no longer registered.
     */
    public void retain(Collection<String> knownInstanceIds) {
        Set<String> known = new HashSet<>(knownInstanceIds);
        states.keySet().removeIf(id -> !known.contains(id));
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public int recoveryThreshold() {
        return recoveryThreshold;
    }

    private void update(String serviceName, String instanceId, long responseTimeMs, boolean failure) {
        if (instanceId == null || instanceId.isBlank()) {
            return;
        }
        Instant now = clock.instant();
        HealthState state = states.computeIfAbsent(instanceId, key -> new HealthState(serviceName));
        Boolean transition;
        synchronized (state) {
            transition = failure
                    ? state.fail(responseTimeMs, now, failureThreshold)
                    : state.succeed(responseTimeMs, now, recoveryThreshold);
        }
        if (transition == null) {
            return;
        }
        if (transition) {
            LOG.info("Instance {} of {} recovered after {} consecutive successes", instanceId, serviceName, recoveryThreshold);
            events.publish(DispatchEvent.forInstance(DispatchEventType.INSTANCE_RECOVERED,
                    serviceName, instanceId, "consecutiveSuccesses=" + recoveryThreshold, now));
        } else {
            LOG.warn("Instance {} of {} marked unhealthy after {} consecutive failures", instanceId, serviceName, failureThreshold);
            events.publish(DispatchEvent.forInstance(DispatchEventType.INSTANCE_FAILED,
                    serviceName, instanceId, "consecutiveFailures=" + failureThreshold, now));
        }
    }

    private static final class HealthState {
        private final String serviceName;
        private volatile boolean healthy = true;
        private int consecutiveFailures;
        private int consecutiveSuccesses;
        private long lastResponseTimeMs;
        private Instant lastCheckedAt;

        private HealthState(String serviceName) {
            this.serviceName = serviceName;
        }

        /**
         * Returns FALSE when this failure flips the instance to unhealthy, otherwise null.
         */
        private Boolean fail(long responseTimeMs, Instant now, int threshold) {
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            lastResponseTimeMs = responseTimeMs;
            lastCheckedAt = now;
            if (healthy && consecutiveFailures >= threshold) {
                healthy = false;
                return Boolean.FALSE;
            }
            return null;
        }

        /**
         * Returns TRUE when this success flips the instance back to healthy, otherwise null.
         */
        private Boolean succeed(long responseTimeMs, Instant now, int threshold) {
            consecutiveSuccesses++;
            consecutiveFailures = 0;
            lastResponseTimeMs = responseTimeMs;
            lastCheckedAt = now;
            if (!healthy && consecutiveSuccesses >= threshold) {
                healthy = true;
                return Boolean.TRUE;
            }
            return null;
        }

        private InstanceHealthRecord snapshot(String instanceId) {
            return new InstanceHealthRecord(instanceId, serviceName, healthy, consecutiveFailures,
                    consecutiveSuccesses, lastResponseTimeMs, lastCheckedAt);
        }
    }
}
