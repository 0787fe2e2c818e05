package net.spookly.hygate.registry;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Issues a single health request to an instance.
 */
public interface HealthProbe {
    /**
     * Completes with the HTTP status code of the health endpoint, or exceptionally on transport
     * failure or when {@code timeoutMs} elapses.
     */
    CompletableFuture<Integer> probe(URI healthUri, int timeoutMs);
}
