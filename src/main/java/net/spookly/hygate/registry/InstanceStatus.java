package net.spookly.hygate.registry;

public enum InstanceStatus {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
