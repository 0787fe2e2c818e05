package net.spookly.hygate.registry;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Service-level retry overrides. Null fields fall back to the proxy defaults.
 */
@Value
@Accessors(fluent = true)
public class RetryPolicy {
    public static final RetryPolicy INHERIT = new RetryPolicy(null, null);

    Integer maxRetries;
    Integer baseDelayMs;
}
