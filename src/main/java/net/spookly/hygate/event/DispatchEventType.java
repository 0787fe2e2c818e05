package net.spookly.hygate.event;

public enum DispatchEventType {
    SERVICE_REGISTERED,
    SERVICE_UNREGISTERED,
    INSTANCE_FAILED,
    INSTANCE_RECOVERED,
    CIRCUIT_OPENED,
    CIRCUIT_HALF_OPENED,
    CIRCUIT_CLOSED
}
