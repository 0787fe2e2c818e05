package net.spookly.hygate.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConfigValidator {
    private static final String[] ALGORITHMS = {
            "round-robin",
            "weighted-round-robin",
            "least-connections",
            "least-response-time",
            "ip-hash",
            "random"
    };

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(HygateConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateGateway(config, errors);
        validateProxy(config, errors);
        validateLoadBalancer(config, errors);
        validateHealth(config, errors);
        validateCircuitBreaker(config, errors);
        validateOps(config, errors);
        Set<String> serviceNames = validateServices(config, errors);
        validateRoutes(config, serviceNames, errors);

        throwIfErrors(errors);
    }

    private static void validateGateway(HygateConfig config, List<String> errors) {
        HygateConfig.GatewayConfig gateway = config.gateway;
        if (gateway == null) {
            return;
        }
        validateListen(gateway.listen, "gateway.listen", errors);
        optionalPositive(errors, gateway.maxContentBytes, "gateway.maxContentBytes");
    }

    private static void validateProxy(HygateConfig config, List<String> errors) {
        HygateConfig.ProxyConfig proxy = config.proxy;
        if (proxy == null) {
            return;
        }
        optionalPositive(errors, proxy.timeoutMs, "proxy.timeoutMs");
        optionalNonNegative(errors, proxy.maxRetries, "proxy.maxRetries");
        optionalNonNegative(errors, proxy.baseDelayMs, "proxy.baseDelayMs");
        optionalPositive(errors, proxy.maxDelayMs, "proxy.maxDelayMs");
        optionalPositive(errors, proxy.connectTimeoutMs, "proxy.connectTimeoutMs");
        int baseDelay = ConfigDefaults.intOrDefault(proxy.baseDelayMs, ConfigDefaults.PROXY_BASE_DELAY_MS);
        int maxDelay = ConfigDefaults.intOrDefault(proxy.maxDelayMs, ConfigDefaults.PROXY_MAX_DELAY_MS);
        if (baseDelay > maxDelay) {
            errors.add("proxy.baseDelayMs must not exceed proxy.maxDelayMs");
        }
    }

    private static void validateLoadBalancer(HygateConfig config, List<String> errors) {
        HygateConfig.LoadBalancerConfig loadBalancer = config.loadBalancer;
        if (loadBalancer == null) {
            return;
        }
        if (loadBalancer.algorithm != null && !isOneOf(loadBalancer.algorithm, ALGORITHMS)) {
            errors.add("loadBalancer.algorithm must be one of: " + String.join(", ", ALGORITHMS));
        }
        optionalPositive(errors, loadBalancer.failureThreshold, "loadBalancer.failureThreshold");
        optionalPositive(errors, loadBalancer.recoveryThreshold, "loadBalancer.recoveryThreshold");
        optionalPositive(errors, loadBalancer.sessionTimeoutMs, "loadBalancer.sessionTimeoutMs");
    }

    private static void validateHealth(HygateConfig config, List<String> errors) {
        HygateConfig.HealthConfig health = config.health;
        if (health == null) {
            return;
        }
        optionalPositive(errors, health.intervalSeconds, "health.intervalSeconds");
        optionalPositive(errors, health.timeoutMs, "health.timeoutMs");
        optionalPositive(errors, health.maxConcurrency, "health.maxConcurrency");
    }

    private static void validateCircuitBreaker(HygateConfig config, List<String> errors) {
        HygateConfig.CircuitBreakerConfig breaker = config.circuitBreaker;
        if (breaker == null) {
            return;
        }
        optionalPositive(errors, breaker.failureThreshold, "circuitBreaker.failureThreshold");
        optionalPositive(errors, breaker.resetTimeoutMs, "circuitBreaker.resetTimeoutMs");
    }

    private static void validateOps(HygateConfig config, List<String> errors) {
        HygateConfig.OpsConfig ops = config.ops;
        if (ops == null || !ConfigDefaults.isTrue(ops.enabled)) {
            return;
        }
        validateListen(ops.listen, "ops.listen", errors);
        if (ops.listen != null && config.gateway != null && config.gateway.listen != null
                && ops.listen.port != null && ops.listen.port.equals(config.gateway.listen.port)) {
            errors.add("ops.listen.port must differ from gateway.listen.port");
        }
    }

    private static Set<String> validateServices(HygateConfig config, List<String> errors) {
        Set<String> names = new HashSet<>();
        if (config.services == null || config.services.isEmpty()) {
            errors.add("services must include at least one service");
            return names;
        }
        Set<String> instanceIds = new HashSet<>();
        for (HygateConfig.ServiceConfig service : config.services) {
            if (service == null) {
                continue;
            }
            requireNonBlank(errors, service.name, "services.name");
            String prefix = "services." + (isBlank(service.name) ? "?" : service.name);
            if (!isBlank(service.name) && !names.add(service.name)) {
                errors.add(prefix + " is declared more than once");
            }
            if (service.healthCheckPath != null && !service.healthCheckPath.startsWith("/")) {
                errors.add(prefix + ".healthCheckPath must start with /");
            }
            optionalPositive(errors, service.baseTimeoutMs, prefix + ".baseTimeoutMs");
            if (service.retryPolicy != null) {
                optionalNonNegative(errors, service.retryPolicy.maxRetries, prefix + ".retryPolicy.maxRetries");
                optionalNonNegative(errors, service.retryPolicy.baseDelayMs, prefix + ".retryPolicy.baseDelayMs");
            }
            if (service.instances == null || service.instances.isEmpty()) {
                errors.add(prefix + ".instances must include at least one instance");
                continue;
            }
            for (HygateConfig.InstanceConfig instance : service.instances) {
                if (instance == null) {
                    continue;
                }
                requireNonBlank(errors, instance.id, prefix + ".instances.id");
                if (!isBlank(instance.id) && !instanceIds.add(instance.id)) {
                    errors.add(prefix + ".instances.id must be unique: " + instance.id);
                }
                validateInstanceUrl(errors, instance.url, prefix + ".instances.url");
                if (instance.weight != null && instance.weight < 1) {
                    errors.add(prefix + ".instances.weight must be at least 1");
                }
            }
        }
        return names;
    }

    private static void validateRoutes(HygateConfig config, Set<String> serviceNames, List<String> errors) {
        if (config.routes == null) {
            return;
        }
        for (HygateConfig.RouteConfig route : config.routes) {
            if (route == null) {
                continue;
            }
            requireNonBlank(errors, route.path, "routes.path");
            if (!isBlank(route.path) && !route.path.startsWith("/")) {
                errors.add("routes.path must start with /: " + route.path);
            }
            requireNonBlank(errors, route.service, "routes.service");
            if (!isBlank(route.service) && !serviceNames.contains(route.service)) {
                errors.add("routes.service must reference a declared service: " + route.service);
            }
            if (route.methods != null) {
                for (String method : route.methods) {
                    if (isBlank(method)) {
                        errors.add("routes.methods must not include blank entries");
                    }
                }
            }
            optionalPositive(errors, route.timeoutMs, "routes.timeoutMs");
            optionalNonNegative(errors, route.retries, "routes.retries");
            if (route.rateLimit != null) {
                requirePositive(errors, route.rateLimit.windowMs, "routes.rateLimit.windowMs");
                requirePositive(errors, route.rateLimit.maxRequests, "routes.rateLimit.maxRequests");
            }
        }
    }

    private static void validateListen(HygateConfig.ListenConfig listen, String field, List<String> errors) {
        if (listen == null) {
            errors.add(field + " is required");
            return;
        }
        requireNonBlank(errors, listen.host, field + ".host");
        requirePort(errors, listen.port, field + ".port");
    }

    private static void validateInstanceUrl(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            URI uri = new URI(value.trim());
            if (!"http".equalsIgnoreCase(uri.getScheme())) {
                errors.add(field + " must use the http scheme: " + value);
            }
            if (isBlank(uri.getHost())) {
                errors.add(field + " must include a host: " + value);
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URL: " + value);
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void optionalPositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void optionalNonNegative(List<String> errors, Integer value, String field) {
        if (value != null && value < 0) {
            errors.add(field + " must not be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
