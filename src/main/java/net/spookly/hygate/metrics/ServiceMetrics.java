package net.spookly.hygate.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class ServiceMetrics {
    String serviceName;
    long requests;
    long successes;
    long failures;
    double averageResponseTimeMs;

    @JsonProperty("failureRate")
    public double failureRate() {
        return Counters.failureRate(failures, requests);
    }
}
