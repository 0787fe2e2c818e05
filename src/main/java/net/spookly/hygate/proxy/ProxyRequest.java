package net.spookly.hygate.proxy;

import io.netty.handler.codec.http.HttpHeaders;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Inbound request as handed to the executor, already detached from the client connection.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ProxyRequest {
    private final String method;
    /**
     * Raw request path without the query string.
     */
    private final String path;
    /**
     * Raw query string without the leading {@code ?}, or null.
     */
    private final String rawQuery;
    private final HttpHeaders headers;
    private final byte[] body;
    /**
     * Client identity for ip-hash, sticky sessions and rate limits (the remote address).
     */
    private final String clientKey;
    private final String requestId;
}
