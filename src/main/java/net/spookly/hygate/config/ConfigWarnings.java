package net.spookly.hygate.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, retry budgets that cannot fit a route timeout).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(HygateConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        warnHealthTiming(config, warnings);
        warnStickyWithIpHash(config, warnings);
        warnRetryBudgets(config, warnings);
        warnUnroutedServices(config, warnings);
        return warnings;
    }

    private static void warnHealthTiming(HygateConfig config, List<String> warnings) {
        HygateConfig.HealthConfig health = config.health;
        if (health == null) {
            return;
        }
        int intervalMs = ConfigDefaults.intOrDefault(health.intervalSeconds, ConfigDefaults.HEALTH_INTERVAL_SECONDS) * 1000;
        int timeoutMs = ConfigDefaults.intOrDefault(health.timeoutMs, ConfigDefaults.HEALTH_TIMEOUT_MS);
        if (timeoutMs >= intervalMs) {
            warnings.add("health.timeoutMs (" + timeoutMs + ") is not shorter than the check interval (" + intervalMs + "ms)");
        }
    }

    private static void warnStickyWithIpHash(HygateConfig config, List<String> warnings) {
        HygateConfig.LoadBalancerConfig loadBalancer = config.loadBalancer;
        if (loadBalancer == null || !ConfigDefaults.isTrue(loadBalancer.stickySession)) {
            return;
        }
        if ("ip-hash".equalsIgnoreCase(loadBalancer.algorithm)) {
            warnings.add("loadBalancer.stickySession is redundant with the ip-hash algorithm");
        }
    }

    private static void warnRetryBudgets(HygateConfig config, List<String> warnings) {
        if (config.routes == null || config.services == null) {
            return;
        }
        HygateConfig.ProxyConfig proxy = config.proxy == null ? new HygateConfig.ProxyConfig() : config.proxy;
        int maxDelay = ConfigDefaults.intOrDefault(proxy.maxDelayMs, ConfigDefaults.PROXY_MAX_DELAY_MS);
        for (HygateConfig.RouteConfig route : config.routes) {
            if (route == null || route.service == null) {
                continue;
            }
            HygateConfig.ServiceConfig service = findService(config, route.service);
            if (service == null) {
                continue;
            }
            HygateConfig.RetryPolicyConfig policy = service.retryPolicy;
            int retries = route.retries != null ? route.retries
                    : policy != null && policy.maxRetries != null ? policy.maxRetries
                    : ConfigDefaults.intOrDefault(proxy.maxRetries, ConfigDefaults.PROXY_MAX_RETRIES);
            int baseDelay = policy != null && policy.baseDelayMs != null ? policy.baseDelayMs
                    : ConfigDefaults.intOrDefault(proxy.baseDelayMs, ConfigDefaults.PROXY_BASE_DELAY_MS);
            int timeout = route.timeoutMs != null ? route.timeoutMs
                    : service.baseTimeoutMs != null ? service.baseTimeoutMs
                    : ConfigDefaults.intOrDefault(proxy.timeoutMs, ConfigDefaults.PROXY_TIMEOUT_MS);
            long totalBackoff = 0;
            for (int attempt = 0; attempt < retries; attempt++) {
                totalBackoff += Math.min((long) baseDelay << Math.min(attempt, 30), maxDelay);
            }
            if (totalBackoff >= timeout) {
                warnings.add("route " + route.path + " backs off " + totalBackoff
                        + "ms across retries but times out after " + timeout + "ms");
            }
        }
    }

    private static void warnUnroutedServices(HygateConfig config, List<String> warnings) {
        if (config.services == null) {
            return;
        }
        Set<String> routed = new HashSet<>();
        if (config.routes != null) {
            for (HygateConfig.RouteConfig route : config.routes) {
                if (route != null && route.service != null) {
                    routed.add(route.service);
                }
            }
        }
        for (HygateConfig.ServiceConfig service : config.services) {
            if (service != null && service.name != null && !routed.contains(service.name)) {
                warnings.add("service " + service.name + " has no routes");
            }
        }
    }

    private static HygateConfig.ServiceConfig findService(HygateConfig config, String name) {
        for (HygateConfig.ServiceConfig service : config.services) {
            if (service != null && name.equals(service.name)) {
                return service;
            }
        }
        return null;
    }
}
