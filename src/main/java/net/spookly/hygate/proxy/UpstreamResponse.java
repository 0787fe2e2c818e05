package net.spookly.hygate.proxy;

import io.netty.handler.codec.http.HttpHeaders;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class UpstreamResponse {
    private final int status;
    private final HttpHeaders headers;
    private final byte[] body;
}
