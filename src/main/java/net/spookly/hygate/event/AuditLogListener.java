package net.spookly.hygate.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one key=value line per dispatch event.
 */
public final class AuditLogListener implements DispatchEventListener {
    public static final AuditLogListener INSTANCE = new AuditLogListener();

    private static final Logger LOG = LoggerFactory.getLogger("net.spookly.hygate.audit");

    private AuditLogListener() {
    }

    @Override
    public void onEvent(DispatchEvent event) {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        LOG.info(format(event));
    }

    static String format(DispatchEvent event) {
        StringBuilder builder = new StringBuilder("dispatch_event");
        append(builder, "type", event.type());
        append(builder, "service", event.serviceName());
        append(builder, "instance", event.instanceId());
        append(builder, "detail", event.detail());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
