package net.spookly.hygate.metrics;

public enum RequestOutcome {
    SUCCESS,
    FAILURE
}
