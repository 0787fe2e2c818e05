package net.spookly.hygate.proxy;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.hygate.registry.HealthProbe;

/**
 * Health probe issuing {@code GET <healthCheckPath>} through the upstream client.
 */
public final class HttpHealthProbe implements HealthProbe {
    private final UpstreamClient client;

    public HttpHealthProbe(UpstreamClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<Integer> probe(URI healthUri, int timeoutMs) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set("user-agent", "hygate-health-check");
        CompletableFuture<UpstreamResponse> exchange = client.execute(new UpstreamRequest("GET", healthUri, headers, null));
        CompletableFuture<Integer> status = exchange.thenApply(UpstreamResponse::status);
        if (timeoutMs > 0) {
            status = status.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        }
        return status.whenComplete((code, error) -> {
            if (error != null) {
                exchange.cancel(false);
            }
        });
    }
}
