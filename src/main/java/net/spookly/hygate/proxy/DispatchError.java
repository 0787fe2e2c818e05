package net.spookly.hygate.proxy;

/**
 * Dispatch failure taxonomy with the HTTP status each maps to. Relayed errors carry the backend's
 * own status; {@link #CLIENT_CANCELLED} produces no response at all.
 */
public enum DispatchError {
    NO_HEALTHY_INSTANCE("NO_HEALTHY_INSTANCE", 503, false),
    CIRCUIT_OPEN("SERVICE_UNAVAILABLE", 503, false),
    UPSTREAM_TIMEOUT("GATEWAY_TIMEOUT", 504, true),
    UPSTREAM_UNREACHABLE("UPSTREAM_UNREACHABLE", 503, true),
    UPSTREAM_SERVER_ERROR("UPSTREAM_SERVER_ERROR", 502, true),
    UPSTREAM_CLIENT_ERROR("UPSTREAM_CLIENT_ERROR", 400, false),
    ROUTE_NOT_FOUND("ROUTE_NOT_FOUND", 404, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    RATE_LIMITED("RATE_LIMITED", 429, false),
    CLIENT_CANCELLED("CLIENT_CANCELLED", 499, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;

    DispatchError(String code, int httpStatus, boolean retryable) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    /**
     * Wire code placed in the error envelope.
     */
    public String code() {
        return code;
    }

    /**
     * Status used when the gateway writes the error itself instead of relaying a backend response.
     */
    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }
}
