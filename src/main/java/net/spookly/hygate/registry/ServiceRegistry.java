package net.spookly.hygate.registry;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import lombok.NonNull;
import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.event.DispatchEvent;
import net.spookly.hygate.event.DispatchEventPublisher;
import net.spookly.hygate.event.DispatchEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory source of truth for services, their instances and the routes that reach them.
 */
public final class ServiceRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, ServiceEntry> services = new ConcurrentHashMap<>();
    private final Map<String, ServiceInstance> instancesById = new ConcurrentHashMap<>();
    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final Object registrationLock = new Object();
    private final HealthProbe healthProbe;
    private final int healthTimeoutMs;
    private final DispatchEventPublisher events;
    private final Clock clock;

    public ServiceRegistry(HealthProbe healthProbe, int healthTimeoutMs, DispatchEventPublisher events, Clock clock) {
        this.healthProbe = healthProbe;
        this.healthTimeoutMs = healthTimeoutMs;
        this.events = events == null ? new DispatchEventPublisher() : events;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ServiceRegistry(HealthProbe healthProbe) {
        this(healthProbe, ConfigDefaults.HEALTH_TIMEOUT_MS, new DispatchEventPublisher(), Clock.systemUTC());
    }

    /**
     * Build a registry holding every service and route declared in config.
     */
    public static ServiceRegistry fromConfig(HygateConfig config,
                                             HealthProbe healthProbe,
                                             DispatchEventPublisher events,
                                             Clock clock) {
        int timeoutMs = config.health == null
                ? ConfigDefaults.HEALTH_TIMEOUT_MS
                : ConfigDefaults.intOrDefault(config.health.timeoutMs, ConfigDefaults.HEALTH_TIMEOUT_MS);
        ServiceRegistry registry = new ServiceRegistry(healthProbe, timeoutMs, events, clock);
        if (config.services != null) {
            for (HygateConfig.ServiceConfig service : config.services) {
                if (service == null) {
                    continue;
                }
                RetryPolicy retryPolicy = service.retryPolicy == null
                        ? RetryPolicy.INHERIT
                        : new RetryPolicy(service.retryPolicy.maxRetries, service.retryPolicy.baseDelayMs);
                ServiceDefinition definition = new ServiceDefinition(
                        service.name, service.healthCheckPath, service.baseTimeoutMs, retryPolicy);
                List<ServiceInstance> instances = new ArrayList<>();
                if (service.instances != null) {
                    for (HygateConfig.InstanceConfig instance : service.instances) {
                        if (instance != null) {
                            int weight = ConfigDefaults.intOrDefault(instance.weight, 1);
                            instances.add(new ServiceInstance(instance.id, service.name, instance.url, weight));
                        }
                    }
                }
                registry.registerService(definition, instances);
            }
        }
        if (config.routes != null) {
            for (HygateConfig.RouteConfig route : config.routes) {
                if (route == null) {
                    continue;
                }
                RateLimit rateLimit = route.rateLimit == null
                        ? null
                        : new RateLimit(route.rateLimit.windowMs, route.rateLimit.maxRequests);
                registry.addRoute(new Route(
                        route.path,
                        route.service,
                        route.methods,
                        ConfigDefaults.isTrue(route.requiresAuth),
                        ConfigDefaults.isTrue(route.stripPathPrefix),
                        rateLimit,
                        route.timeoutMs,
                        route.retries));
            }
        }
        return registry;
    }

    /**
     * Register a service, replacing any prior definition and instance list with the same name.
     */
    public void registerService(@NonNull ServiceDefinition definition, List<ServiceInstance> instances) {
        List<ServiceInstance> stored = new ArrayList<>();
        if (instances != null) {
            for (ServiceInstance instance : instances) {
                if (instance == null) {
                    continue;
                }
                if (instance.serviceName() != null && !definition.name().equals(instance.serviceName())) {
                    throw new IllegalArgumentException("instance " + instance.id()
                            + " belongs to service " + instance.serviceName() + ", not " + definition.name());
                }
                stored.add(instance.serviceName() == null
                        ? new ServiceInstance(instance.id(), definition.name(), instance.url().toString(), instance.weight())
                        : instance);
            }
        }
        synchronized (registrationLock) {
            for (ServiceInstance instance : stored) {
                ServiceInstance existing = instancesById.get(instance.id());
                if (existing != null && !definition.name().equals(existing.serviceName())) {
                    throw new IllegalArgumentException("instance id already registered by service "
                            + existing.serviceName() + ": " + instance.id());
                }
            }
            ServiceEntry previous = services.put(definition.name(),
                    new ServiceEntry(definition, Collections.unmodifiableList(stored)));
            if (previous != null) {
                for (ServiceInstance instance : previous.instances) {
                    instancesById.remove(instance.id());
                }
            }
            for (ServiceInstance instance : stored) {
                instancesById.put(instance.id(), instance);
            }
        }
        LOG.info("Registered service {} with {} instance(s)", definition.name(), stored.size());
        events.publish(DispatchEvent.forService(DispatchEventType.SERVICE_REGISTERED,
                definition.name(), "instances=" + stored.size(), clock.instant()));
    }

    /**
     * Remove a service and its instances. Routes pointing at it stay declared and resolve to no instances.
     */
    public boolean unregisterService(String name) {
        if (name == null) {
            return false;
        }
        ServiceEntry removed;
        synchronized (registrationLock) {
            removed = services.remove(name);
            if (removed != null) {
                for (ServiceInstance instance : removed.instances) {
                    instancesById.remove(instance.id());
                }
            }
        }
        if (removed == null) {
            return false;
        }
        LOG.info("Unregistered service {}", name);
        events.publish(DispatchEvent.forService(DispatchEventType.SERVICE_UNREGISTERED, name, null, clock.instant()));
        return true;
    }

    public ServiceDefinition getService(String name) {
        ServiceEntry entry = name == null ? null : services.get(name);
        return entry == null ? null : entry.definition;
    }

    /**
     * All registered service definitions ordered by name.
     */
    public List<ServiceDefinition> getAllServices() {
        List<ServiceDefinition> definitions = new ArrayList<>();
        for (ServiceEntry entry : services.values()) {
            definitions.add(entry.definition);
        }
        definitions.sort(Comparator.comparing(ServiceDefinition::name));
        return definitions;
    }

    /**
     * Live instance list for a service; empty when the service is unknown.
     */
    public List<ServiceInstance> getInstances(String serviceName) {
        ServiceEntry entry = serviceName == null ? null : services.get(serviceName);
        return entry == null ? Collections.emptyList() : entry.instances;
    }

    public ServiceInstance getInstance(String instanceId) {
        return instanceId == null ? null : instancesById.get(instanceId);
    }

    public List<ServiceInstance> getAllInstances() {
        List<ServiceInstance> all = new ArrayList<>();
        for (ServiceDefinition definition : getAllServices()) {
            all.addAll(getInstances(definition.name()));
        }
        return all;
    }

    public void addRoute(@NonNull Route route) {
        routes.add(route);
        LOG.debug("Added route {}", route);
    }

    public List<Route> getAllRoutes() {
        return Collections.unmodifiableList(new ArrayList<>(routes));
    }

    /**
     * Most specific route matching the path and method, or null when none matches.
     * Routes with equal specificity resolve to the one declared first.
     */
    public Route resolveRoute(String path, String method) {
        Route best = null;
        for (Route route : routes) {
            if (!route.matches(path, method)) {
                continue;
            }
            if (best == null || route.specificity() > best.specificity()) {
                best = route;
            }
        }
        return best;
    }

    /**
     * Probe an instance's health endpoint and record the outcome on the instance. The returned
     * future never completes exceptionally; probe failures surface as unhealthy results.
     */
    public CompletableFuture<HealthCheckResult> checkHealth(String instanceId) {
        ServiceInstance instance = getInstance(instanceId);
        if (instance == null) {
            throw new IllegalArgumentException("instance not found: " + instanceId);
        }
        ServiceDefinition definition = getService(instance.serviceName());
        String healthPath = definition == null ? ConfigDefaults.HEALTH_CHECK_PATH : definition.healthCheckPath();
        URI healthUri = instance.resolve(healthPath, null);
        long started = System.nanoTime();
        CompletableFuture<Integer> probe;
        try {
            probe = healthProbe.probe(healthUri, healthTimeoutMs);
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }
        return probe.handle((status, error) -> {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
            Instant now = clock.instant();
            boolean healthy = error == null && status != null && status >= 200 && status < 300;
            String detail = null;
            if (error != null) {
                detail = describe(error);
            } else if (!healthy) {
                detail = "status " + status;
            }
            instance.markChecked(healthy ? InstanceStatus.HEALTHY : InstanceStatus.UNHEALTHY, now, elapsedMs);
            if (!healthy) {
                LOG.debug("Health check failed for {}: {}", instance, detail);
            }
            return new HealthCheckResult(instance.id(), instance.serviceName(), healthy,
                    status == null ? 0 : status, elapsedMs, detail, now);
        });
    }

    public RegistryStats getStats() {
        int total = 0;
        int healthy = 0;
        int unhealthy = 0;
        int unknown = 0;
        long checkedMs = 0;
        int checked = 0;
        for (ServiceEntry entry : services.values()) {
            for (ServiceInstance instance : entry.instances) {
                total++;
                InstanceStatus status = instance.status();
                if (status == InstanceStatus.HEALTHY) {
                    healthy++;
                } else if (status == InstanceStatus.UNHEALTHY) {
                    unhealthy++;
                } else {
                    unknown++;
                }
                if (instance.lastCheckedAt() != null) {
                    checkedMs += instance.lastCheckMs();
                    checked++;
                }
            }
        }
        double average = checked == 0 ? 0 : (double) checkedMs / checked;
        return new RegistryStats(services.size(), total, healthy, unhealthy, unknown, routes.size(), average);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return Objects.toString(cause.getMessage(), cause.getClass().getSimpleName());
    }

    private static final class ServiceEntry {
        private final ServiceDefinition definition;
        private final List<ServiceInstance> instances;

        private ServiceEntry(ServiceDefinition definition, List<ServiceInstance> instances) {
            this.definition = definition;
            this.instances = instances;
        }
    }
}
