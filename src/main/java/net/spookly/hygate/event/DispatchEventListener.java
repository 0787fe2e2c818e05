package net.spookly.hygate.event;

/**
 * Listener for dispatch state changes.
 */
@FunctionalInterface
public interface DispatchEventListener {
    DispatchEventListener NOOP = event -> {
    };

    void onEvent(DispatchEvent event);
}
