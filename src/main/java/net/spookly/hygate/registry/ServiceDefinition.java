package net.spookly.hygate.registry;

import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable description of a backend service as loaded from configuration.
 */
@Getter
@Accessors(fluent = true)
public final class ServiceDefinition {
    private final String name;
    private final String healthCheckPath;
    /**
     * Request deadline for routes without their own timeout; null inherits the proxy default.
     */
    private final Integer baseTimeoutMs;
    private final RetryPolicy retryPolicy;

    public ServiceDefinition(String name, String healthCheckPath, Integer baseTimeoutMs, RetryPolicy retryPolicy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service name is required");
        }
        this.name = name;
        this.healthCheckPath = healthCheckPath == null || healthCheckPath.isBlank() ? "/health" : healthCheckPath;
        this.baseTimeoutMs = baseTimeoutMs;
        this.retryPolicy = Objects.requireNonNullElse(retryPolicy, RetryPolicy.INHERIT);
    }

    public static ServiceDefinition of(String name) {
        return new ServiceDefinition(name, null, null, null);
    }
}
