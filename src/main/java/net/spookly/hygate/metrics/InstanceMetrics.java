package net.spookly.hygate.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Per-instance counters. Request fields count client requests that ended on this instance;
 * attempt fields count every individual network attempt, retries included.
 */
@Value
@Accessors(fluent = true)
public class InstanceMetrics {
    String instanceId;
    String serviceName;
    long requests;
    long successes;
    long failures;
    double averageResponseTimeMs;
    long attempts;
    long failedAttempts;
    double averageAttemptTimeMs;

    @JsonProperty("failureRate")
    public double failureRate() {
        return Counters.failureRate(failures, requests);
    }
}
