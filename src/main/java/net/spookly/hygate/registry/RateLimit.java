package net.spookly.hygate.registry;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Fixed-window request budget applied per client key on a single route.
 */
@Value
@Accessors(fluent = true)
public class RateLimit {
    long windowMs;
    int maxRequests;
}
