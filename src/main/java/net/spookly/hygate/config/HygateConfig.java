package net.spookly.hygate.config;

import java.util.List;

public class HygateConfig {
    public GatewayConfig gateway;
    public ProxyConfig proxy;
    public LoadBalancerConfig loadBalancer;
    public HealthConfig health;
    public CircuitBreakerConfig circuitBreaker;
    public OpsConfig ops;
    public List<ServiceConfig> services;
    public List<RouteConfig> routes;

    public static class GatewayConfig {
        public ListenConfig listen;
        /**
         * Largest inbound request body the gateway aggregates before rejecting with 413.
         */
        public Integer maxContentBytes;
    }

    public static class ListenConfig {
        public String host;
        public Integer port;
    }

    public static class ProxyConfig {
        /**
         * Default wall-clock budget per request, retries included.
         */
        public Integer timeoutMs;
        public Integer maxRetries;
        public Integer baseDelayMs;
        public Integer maxDelayMs;
        public Integer connectTimeoutMs;
    }

    public static class LoadBalancerConfig {
        public String algorithm;
        public Integer failureThreshold;
        public Integer recoveryThreshold;
        public Boolean stickySession;
        public Integer sessionTimeoutMs;
    }

    public static class HealthConfig {
        public Boolean enabled;
        public Integer intervalSeconds;
        public Integer timeoutMs;
        public Integer maxConcurrency;
    }

    public static class CircuitBreakerConfig {
        public Integer failureThreshold;
        public Integer resetTimeoutMs;
    }

    public static class OpsConfig {
        public Boolean enabled;
        public ListenConfig listen;
    }

    public static class ServiceConfig {
        public String name;
        public String healthCheckPath;
        public Integer baseTimeoutMs;
        public RetryPolicyConfig retryPolicy;
        public List<InstanceConfig> instances;
    }

    public static class RetryPolicyConfig {
        public Integer maxRetries;
        public Integer baseDelayMs;
    }

    public static class InstanceConfig {
        public String id;
        public String url;
        public Integer weight;
    }

    public static class RouteConfig {
        public String path;
        public String service;
        public List<String> methods;
        public Boolean requiresAuth;
        public Boolean stripPathPrefix;
        public Integer timeoutMs;
        public Integer retries;
        public RateLimitConfig rateLimit;
    }

    public static class RateLimitConfig {
        public Integer windowMs;
        public Integer maxRequests;
    }
}
