package net.spookly.hygate.proxy;

/**
 * Exponential backoff: attempt {@code n} (from 0) waits {@code min(baseDelay * 2^n, maxDelay)}.
 */
public final class RetryBackoff {
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryBackoff(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("backoff delays must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public long delayMs(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        int shift = Math.min(attempt, 30);
        long delay = baseDelayMs << shift;
        if (delay < 0 || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }
}
