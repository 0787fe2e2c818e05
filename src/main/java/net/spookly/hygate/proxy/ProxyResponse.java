package net.spookly.hygate.proxy;

import io.netty.handler.codec.http.HttpHeaders;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Backend response relayed to the client, with hop-by-hop headers removed.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ProxyResponse {
    private final int status;
    private final HttpHeaders headers;
    private final byte[] body;
    private final String instanceId;
    /**
     * Network attempts made, the first one included.
     */
    private final int attempts;
}
