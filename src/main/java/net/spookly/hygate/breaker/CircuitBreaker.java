package net.spookly.hygate.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import net.spookly.hygate.event.DispatchEvent;
import net.spookly.hygate.event.DispatchEventPublisher;
import net.spookly.hygate.event.DispatchEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service-scoped failure isolation.
 * <p>
 * CLOSED counts failures and opens at {@code failureThreshold}. OPEN rejects until
 * {@code resetTimeout} has passed since the last failure, then moves to HALF_OPEN on the next
 * query. HALF_OPEN admits one trial: success closes the circuit, failure reopens it. Only the
 * trial's own {@link Permit} settles HALF_OPEN; results of requests admitted earlier are ignored
 * there.
 */
public final class CircuitBreaker {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceName;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final DispatchEventPublisher events;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private boolean trialInFlight;
    private long trialGeneration;

    public CircuitBreaker(String serviceName,
                          int failureThreshold,
                          Duration resetTimeout,
                          Clock clock,
                          DispatchEventPublisher events) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.serviceName = serviceName;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.events = events == null ? new DispatchEventPublisher() : events;
    }

    /**
     * Ask to send a request. Returns null while open, and while a half-open trial is outstanding.
     * Every permit handed out must be settled exactly once through {@link #recordSuccess(Permit)}
     * or {@link #recordFailure(Permit)}.
     */
    public Permit tryAcquire() {
        DispatchEvent event = null;
        Permit permit;
        synchronized (this) {
            if (advance()) {
                event = transitionEvent(CircuitState.HALF_OPEN);
            }
            if (state == CircuitState.CLOSED) {
                permit = new Permit(false, trialGeneration);
            } else if (state == CircuitState.HALF_OPEN && !trialInFlight) {
                trialInFlight = true;
                permit = new Permit(true, trialGeneration);
            } else {
                permit = null;
            }
        }
        publish(event);
        return permit;
    }

    public void recordSuccess(Permit permit) {
        DispatchEvent event = null;
        synchronized (this) {
            if (state == CircuitState.HALF_OPEN) {
                if (isCurrentTrial(permit)) {
                    state = CircuitState.CLOSED;
                    failureCount = 0;
                    trialInFlight = false;
                    event = transitionEvent(CircuitState.CLOSED);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        }
        publish(event);
    }

    public void recordFailure(Permit permit) {
        DispatchEvent event = null;
        synchronized (this) {
            Instant now = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                if (isCurrentTrial(permit)) {
                    state = CircuitState.OPEN;
                    failureCount++;
                    lastFailureAt = now;
                    trialInFlight = false;
                    event = transitionEvent(CircuitState.OPEN);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount++;
                lastFailureAt = now;
                if (failureCount >= failureThreshold) {
                    state = CircuitState.OPEN;
                    event = transitionEvent(CircuitState.OPEN);
                }
            } else {
                // Late result of a request admitted before the circuit opened.
                failureCount++;
            }
        }
        publish(event);
    }

    /**
     * Current state, applying the lazy OPEN to HALF_OPEN transition.
     */
    public CircuitState state() {
        DispatchEvent event = null;
        CircuitState current;
        synchronized (this) {
            if (advance()) {
                event = transitionEvent(CircuitState.HALF_OPEN);
            }
            current = state;
        }
        publish(event);
        return current;
    }

    public CircuitBreakerState snapshot() {
        state();
        synchronized (this) {
            return new CircuitBreakerState(serviceName, state, failureCount, lastFailureAt, trialInFlight);
        }
    }

    public String serviceName() {
        return serviceName;
    }

    private boolean advance() {
        if (state != CircuitState.OPEN || lastFailureAt == null) {
            return false;
        }
        if (Duration.between(lastFailureAt, clock.instant()).compareTo(resetTimeout) < 0) {
            return false;
        }
        state = CircuitState.HALF_OPEN;
        trialInFlight = false;
        trialGeneration++;
        return true;
    }

    private boolean isCurrentTrial(Permit permit) {
        return permit != null && permit.trial && permit.generation == trialGeneration;
    }

    private DispatchEvent transitionEvent(CircuitState next) {
        DispatchEventType type;
        if (next == CircuitState.OPEN) {
            type = DispatchEventType.CIRCUIT_OPENED;
        } else if (next == CircuitState.HALF_OPEN) {
            type = DispatchEventType.CIRCUIT_HALF_OPENED;
        } else {
            type = DispatchEventType.CIRCUIT_CLOSED;
        }
        return DispatchEvent.forService(type, serviceName, "failureCount=" + failureCount, clock.instant());
    }

    private void publish(DispatchEvent event) {
        if (event == null) {
            return;
        }
        if (event.type() == DispatchEventType.CIRCUIT_OPENED) {
            LOG.warn("Circuit for {} opened ({})", serviceName, event.detail());
        } else {
            LOG.info("Circuit for {} {}", serviceName,
                    event.type() == DispatchEventType.CIRCUIT_CLOSED ? "closed" : "half-open, admitting a trial request");
        }
        events.publish(event);
    }

    /**
     * Admission handed out by {@link #tryAcquire()}.
     */
    public static final class Permit {
        private final boolean trial;
        private final long generation;

        private Permit(boolean trial, long generation) {
            this.trial = trial;
            this.generation = generation;
        }

        /**
         * True for the single request admitted while half-open.
         */
        public boolean isTrial() {
            return trial;
        }
    }
}
