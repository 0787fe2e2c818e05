package net.spookly.hygate.breaker;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class CircuitBreakerState {
    String serviceName;
    CircuitState state;
    int failureCount;
    Instant lastFailureAt;
    /**
     * True while the single half-open trial request is outstanding.
     */
    boolean trialInFlight;
}
