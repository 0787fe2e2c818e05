package net.spookly.hygate.breaker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.event.DispatchEventPublisher;

/**
 * One circuit breaker per service, created on first use.
 */
public final class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final DispatchEventPublisher events;

    public CircuitBreakerRegistry(int failureThreshold, Duration resetTimeout, Clock clock, DispatchEventPublisher events) {
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
        this.events = events;
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration resetTimeout, Clock clock) {
        this(failureThreshold, resetTimeout, clock, new DispatchEventPublisher());
    }

    public static CircuitBreakerRegistry fromConfig(HygateConfig config, Clock clock, DispatchEventPublisher events) {
        HygateConfig.CircuitBreakerConfig section = config.circuitBreaker == null
                ? new HygateConfig.CircuitBreakerConfig()
                : config.circuitBreaker;
        return new CircuitBreakerRegistry(
                ConfigDefaults.intOrDefault(section.failureThreshold, ConfigDefaults.BREAKER_FAILURE_THRESHOLD),
                Duration.ofMillis(ConfigDefaults.intOrDefault(section.resetTimeoutMs, ConfigDefaults.BREAKER_RESET_TIMEOUT_MS)),
                clock,
                events);
    }

    public CircuitBreaker forService(String serviceName) {
        return breakers.computeIfAbsent(serviceName,
                name -> new CircuitBreaker(name, failureThreshold, resetTimeout, clock, events));
    }

    public List<CircuitBreakerState> snapshots() {
        List<CircuitBreakerState> states = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            states.add(breaker.snapshot());
        }
        states.sort(Comparator.comparing(CircuitBreakerState::serviceName));
        return states;
    }
}
