package net.spookly.hygate.routing;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Point-in-time copy of an instance's rolling health state.
 */
@Value
@Accessors(fluent = true)
public class InstanceHealthRecord {
    String instanceId;
    String serviceName;
    boolean healthy;
    int consecutiveFailures;
    int consecutiveSuccesses;
    long lastResponseTimeMs;
    Instant lastCheckedAt;

    /**
     * Record reported for an instance that has produced no outcomes yet.
     */
    public static InstanceHealthRecord assumedHealthy(String instanceId, String serviceName) {
        return new InstanceHealthRecord(instanceId, serviceName, true, 0, 0, 0, null);
    }
}
