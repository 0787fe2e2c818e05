package net.spookly.hygate.metrics;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Point-in-time copy of the aggregator's counters. Failure rates are derived on read.
 */
@Value
@Accessors(fluent = true)
public class RequestMetricsSnapshot {
    Instant capturedAt;
    long totalRequests;
    long successCount;
    long failureCount;
    double averageResponseTimeMs;
    long activeConnections;
    Map<String, ServiceMetrics> services;
    Map<String, InstanceMetrics> instances;
    Map<String, Long> errorsByCode;

    @JsonProperty("failureRate")
    public double failureRate() {
        return Counters.failureRate(failureCount, totalRequests);
    }
}
