package net.spookly.hygate.registry;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class HealthCheckResult {
    String instanceId;
    String serviceName;
    boolean healthy;
    /**
     * HTTP status returned by the health endpoint, or 0 when no response arrived.
     */
    int statusCode;
    long responseTimeMs;
    String error;
    Instant checkedAt;
}
