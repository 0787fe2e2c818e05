package net.spookly.hygate.proxy;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;

/**
 * Headers that describe a single transport hop and must not be forwarded.
 */
public final class HopByHopHeaders {
    private static final Set<String> NAMES = Set.of(
            "connection",
            "keep-alive",
            "transfer-encoding",
            "upgrade",
            "te",
            "trailers",
            "trailer",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection"
    );

    private HopByHopHeaders() {
    }

    public static boolean isHopByHop(String name) {
        return name != null && NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Copy of the headers without hop-by-hop entries, including any named in {@code Connection}.
     */
    public static HttpHeaders strip(HttpHeaders source) {
        Set<String> listed = connectionTokens(source);
        HttpHeaders copy = new DefaultHttpHeaders();
        for (Map.Entry<String, String> header : source) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (NAMES.contains(name) || listed.contains(name)) {
                continue;
            }
            copy.add(header.getKey(), header.getValue());
        }
        return copy;
    }

    private static Set<String> connectionTokens(HttpHeaders headers) {
        Set<String> tokens = new HashSet<>();
        List<String> values = headers.getAll(HttpHeaderNames.CONNECTION);
        for (String value : values) {
            for (String token : value.split(",")) {
                String trimmed = token.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    tokens.add(trimmed);
                }
            }
        }
        return tokens;
    }
}
