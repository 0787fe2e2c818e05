package net.spookly.hygate.ops;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.hygate.breaker.CircuitBreakerRegistry;
import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.registry.HealthCheckResult;
import net.spookly.hygate.registry.Route;
import net.spookly.hygate.registry.ServiceDefinition;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import net.spookly.hygate.routing.HealthCheckService;
import net.spookly.hygate.routing.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-mostly operator API for dashboards: metrics, instance health, services, routes and circuits.
 */
public final class OpsServer {
    private static final Logger LOG = LoggerFactory.getLogger(OpsServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    private static final long ON_DEMAND_CHECK_TIMEOUT_MS = 30_000L;

    private final ServiceRegistry registry;
    private final LoadBalancer loadBalancer;
    private final HealthCheckService healthChecks;
    private final CircuitBreakerRegistry breakers;
    private final MetricsAggregator metrics;
    private final Clock clock;
    private final Instant startedAt;
    private final HttpServer server;
    private final ExecutorService executor;

    public OpsServer(String host,
                     int port,
                     ServiceRegistry registry,
                     LoadBalancer loadBalancer,
                     HealthCheckService healthChecks,
                     CircuitBreakerRegistry breakers,
                     MetricsAggregator metrics,
                     Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "loadBalancer");
        this.healthChecks = Objects.requireNonNull(healthChecks, "healthChecks");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
        try {
            this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind ops listener on " + host + ":" + port, e);
        }
        this.executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "hygate-ops");
            thread.setDaemon(true);
            return thread;
        });
        this.server.setExecutor(executor);
        this.server.createContext("/health", new StatusHandler());
        this.server.createContext("/v1/metrics", new MetricsHandler());
        this.server.createContext("/v1/instances/health", new InstanceHealthHandler());
        this.server.createContext("/v1/services", new ServicesHandler());
        this.server.createContext("/v1/routes", new RoutesHandler());
        this.server.createContext("/v1/circuits", new CircuitsHandler());
    }

    public void start() {
        server.start();
        LOG.info("Ops API listening on {}:{}", server.getAddress().getHostString(), boundPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    public int boundPort() {
        return server.getAddress().getPort();
    }

    private abstract class BaseHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                handleRequest(exchange, exchange.getRequestURI().getPath());
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, OpsResponse.error("BAD_REQUEST", e.getMessage()));
            } catch (Exception e) {
                LOG.error("Ops request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeResponse(exchange, 500, OpsResponse.error("INTERNAL_ERROR", "Internal server error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleRequest(HttpExchange exchange, String path) throws Exception;

        protected boolean requireMethod(HttpExchange exchange, String method) throws IOException {
            if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
                return true;
            }
            writeResponse(exchange, 405, OpsResponse.error("METHOD_NOT_ALLOWED", "method not allowed"));
            return false;
        }

        protected void notFound(HttpExchange exchange, String message) throws IOException {
            writeResponse(exchange, 404, OpsResponse.error("NOT_FOUND", message));
        }
    }

    private final class StatusHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws IOException {
            if (!"/health".equals(path)) {
                notFound(exchange, "not found");
                return;
            }
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", "ok");
            data.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).getSeconds());
            data.put("algorithm", loadBalancer.algorithm().configValue());
            data.put("registry", registry.getStats());
            writeResponse(exchange, 200, OpsResponse.ok(data));
        }
    }

    private final class MetricsHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws IOException {
            if ("/v1/metrics/reset".equals(path)) {
                if (!requireMethod(exchange, "POST")) {
                    return;
                }
                metrics.reset();
                LOG.info("Metrics reset via ops API");
                writeResponse(exchange, 200, OpsResponse.ok(Map.of("reset", true)));
                return;
            }
            if (!"/v1/metrics".equals(path)) {
                notFound(exchange, "not found");
                return;
            }
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("requests", metrics.snapshot());
            data.put("connections", loadBalancer.connectionCounts());
            writeResponse(exchange, 200, OpsResponse.ok(data));
        }
    }

    private final class InstanceHealthHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            writeResponse(exchange, 200, OpsResponse.ok(loadBalancer.getInstanceHealth()));
        }
    }

    private final class ServicesHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws Exception {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            if ("/v1/services".equals(path) || "/v1/services/".equals(path)) {
                List<Map<String, Object>> services = new ArrayList<>();
                for (ServiceDefinition definition : registry.getAllServices()) {
                    services.add(describe(definition));
                }
                writeResponse(exchange, 200, OpsResponse.ok(services));
                return;
            }
            String remainder = path.substring("/v1/services/".length());
            if (!remainder.endsWith("/health")) {
                notFound(exchange, "not found");
                return;
            }
            String name = remainder.substring(0, remainder.length() - "/health".length());
            if (registry.getService(name) == null) {
                notFound(exchange, "service not found: " + name);
                return;
            }
            List<HealthCheckResult> results;
            try {
                results = healthChecks.checkService(name).get(ON_DEMAND_CHECK_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                writeResponse(exchange, 504, OpsResponse.error("GATEWAY_TIMEOUT", "health checks did not finish in time"));
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while checking " + name, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("health check failed for " + name, e.getCause());
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("service", name);
            data.put("healthy", results.stream().allMatch(HealthCheckResult::healthy));
            data.put("instances", results);
            writeResponse(exchange, 200, OpsResponse.ok(data));
        }

        private Map<String, Object> describe(ServiceDefinition definition) {
            Map<String, Object> service = new LinkedHashMap<>();
            service.put("name", definition.name());
            service.put("healthCheckPath", definition.healthCheckPath());
            service.put("baseTimeoutMs", definition.baseTimeoutMs());
            service.put("retryPolicy", definition.retryPolicy());
            List<Map<String, Object>> instances = new ArrayList<>();
            for (ServiceInstance instance : registry.getInstances(definition.name())) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", instance.id());
                entry.put("url", instance.url().toString());
                entry.put("weight", instance.weight());
                entry.put("status", instance.status());
                entry.put("lastCheckedAt", instance.lastCheckedAt());
                entry.put("connections", loadBalancer.connectionCount(instance.id()));
                entry.put("averageResponseTimeMs", loadBalancer.averageResponseTime(instance.id()));
                instances.add(entry);
            }
            service.put("instances", instances);
            return service;
        }
    }

    private final class RoutesHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            List<Map<String, Object>> routes = new ArrayList<>();
            for (Route route : registry.getAllRoutes()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("path", route.pathPattern());
                entry.put("service", route.targetService());
                entry.put("methods", route.methods());
                entry.put("requiresAuth", route.requiresAuth());
                entry.put("stripPathPrefix", route.stripPathPrefix());
                entry.put("timeoutMs", route.timeoutMs());
                entry.put("retries", route.retries());
                entry.put("rateLimit", route.rateLimit());
                routes.add(entry);
            }
            writeResponse(exchange, 200, OpsResponse.ok(routes));
        }
    }

    private final class CircuitsHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange, String path) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            writeResponse(exchange, 200, OpsResponse.ok(breakers.snapshots()));
        }
    }

    private void writeResponse(HttpExchange exchange, int status, OpsResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }
}
