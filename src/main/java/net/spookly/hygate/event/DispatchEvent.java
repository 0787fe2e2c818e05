package net.spookly.hygate.event;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a registry, health or circuit state change.
 */
@Value
@Accessors(fluent = true)
public class DispatchEvent {
    DispatchEventType type;
    Instant timestamp;
    String serviceName;
    /**
     * Instance the event concerns; null for service-scoped events.
     */
    String instanceId;
    String detail;

    public static DispatchEvent forService(DispatchEventType type, String serviceName, String detail, Instant timestamp) {
        return new DispatchEvent(type, timestamp, serviceName, null, detail);
    }

    public static DispatchEvent forInstance(DispatchEventType type,
                                            String serviceName,
                                            String instanceId,
                                            String detail,
                                            Instant timestamp) {
        return new DispatchEvent(type, timestamp, serviceName, instanceId, detail);
    }
}
