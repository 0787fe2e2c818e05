package net.spookly.hygate.proxy;

import java.util.concurrent.CompletableFuture;

/**
 * Transport for one HTTP exchange with a backend instance.
 * <p>
 * The returned future completes with whatever response arrived (any status), or exceptionally
 * with the transport failure. Cancelling the future aborts the exchange.
 */
public interface UpstreamClient extends AutoCloseable {
    CompletableFuture<UpstreamResponse> execute(UpstreamRequest request);

    @Override
    default void close() {
    }
}
