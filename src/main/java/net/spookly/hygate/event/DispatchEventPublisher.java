package net.spookly.hygate.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit subscriber list for dispatch events. Listeners run on the publishing thread.
 */
public final class DispatchEventPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(DispatchEventPublisher.class);

    private final List<DispatchEventListener> listeners = new CopyOnWriteArrayList<>();

    public DispatchEventPublisher() {
    }

    public DispatchEventPublisher(DispatchEventListener... initial) {
        for (DispatchEventListener listener : initial) {
            subscribe(listener);
        }
    }

    public void subscribe(DispatchEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void unsubscribe(DispatchEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Deliver the event to every listener; a failing listener does not stop delivery to the rest.
     */
    public void publish(DispatchEvent event) {
        if (event == null) {
            return;
        }
        for (DispatchEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Dispatch event listener failed for {}: {}", event.type(), e.getMessage());
            }
        }
    }
}
