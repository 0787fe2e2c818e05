package net.spookly.hygate.proxy;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.registry.RetryPolicy;
import net.spookly.hygate.registry.Route;
import net.spookly.hygate.registry.ServiceDefinition;

/**
 * Proxy-wide dispatch defaults and their per-route resolution.
 * Retries resolve route, then service retry policy, then proxy default; the deadline resolves
 * route timeout, then service base timeout, then proxy default.
 */
public final class ProxySettings {
    private final int timeoutMs;
    private final int maxRetries;
    private final int baseDelayMs;
    private final int maxDelayMs;

    public ProxySettings(int timeoutMs, int maxRetries, int baseDelayMs, int maxDelayMs) {
        this.timeoutMs = timeoutMs;
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static ProxySettings defaults() {
        return new ProxySettings(ConfigDefaults.PROXY_TIMEOUT_MS, ConfigDefaults.PROXY_MAX_RETRIES,
                ConfigDefaults.PROXY_BASE_DELAY_MS, ConfigDefaults.PROXY_MAX_DELAY_MS);
    }

    public static ProxySettings fromConfig(HygateConfig config) {
        HygateConfig.ProxyConfig proxy = config.proxy == null ? new HygateConfig.ProxyConfig() : config.proxy;
        return new ProxySettings(
                ConfigDefaults.intOrDefault(proxy.timeoutMs, ConfigDefaults.PROXY_TIMEOUT_MS),
                ConfigDefaults.intOrDefault(proxy.maxRetries, ConfigDefaults.PROXY_MAX_RETRIES),
                ConfigDefaults.intOrDefault(proxy.baseDelayMs, ConfigDefaults.PROXY_BASE_DELAY_MS),
                ConfigDefaults.intOrDefault(proxy.maxDelayMs, ConfigDefaults.PROXY_MAX_DELAY_MS));
    }

    public Resolved resolve(Route route, ServiceDefinition service) {
        RetryPolicy policy = service == null ? RetryPolicy.INHERIT : service.retryPolicy();
        int retries = maxRetries;
        if (route != null && route.retries() != null) {
            retries = route.retries();
        } else if (policy.maxRetries() != null) {
            retries = policy.maxRetries();
        }
        int baseDelay = policy.baseDelayMs() != null ? policy.baseDelayMs() : baseDelayMs;
        int timeout = timeoutMs;
        if (route != null && route.timeoutMs() != null) {
            timeout = route.timeoutMs();
        } else if (service != null && service.baseTimeoutMs() != null) {
            timeout = service.baseTimeoutMs();
        }
        return new Resolved(timeout, retries, new RetryBackoff(baseDelay, Math.max(baseDelay, maxDelayMs)));
    }

    @Value
    @Accessors(fluent = true)
    public static class Resolved {
        int timeoutMs;
        int maxRetries;
        RetryBackoff backoff;
    }
}
