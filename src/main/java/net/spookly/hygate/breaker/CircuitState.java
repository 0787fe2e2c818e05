package net.spookly.hygate.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
