package net.spookly.hygate.proxy;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.hygate.breaker.CircuitBreakerRegistry;
import net.spookly.hygate.breaker.CircuitState;
import net.spookly.hygate.metrics.InstanceMetrics;
import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.metrics.RequestMetricsSnapshot;
import net.spookly.hygate.registry.Route;
import net.spookly.hygate.registry.ServiceDefinition;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import net.spookly.hygate.routing.BalancingAlgorithm;
import net.spookly.hygate.routing.InstanceHealthTracker;
import net.spookly.hygate.routing.LoadBalancer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProxyExecutorTest {
    private static final Route USERS = new Route("/api/users/*", "users", null, false, true, null, null, null);

    private ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final StubClient client = new StubClient();
    private final MetricsAggregator metrics = new MetricsAggregator();
    private ServiceRegistry registry;
    private InstanceHealthTracker tracker;
    private LoadBalancer loadBalancer;
    private CircuitBreakerRegistry breakers;

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void rewritesPathAndHeadersForBackend() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");
        HttpHeaders headers = new DefaultHttpHeaders()
                .add("Host", "gateway.local")
                .add("Connection", "keep-alive, X-Hop")
                .add("X-Hop", "1")
                .add("Content-Length", "5")
                .add("X-Forwarded-For", "198.51.100.1")
                .add("Authorization", "Bearer token");

        ProxyResponse response = executor.forward(
                new ProxyRequest("GET", "/api/users/42", "expand=true", headers, bytes("ignored"), "192.0.2.10", "req-1"),
                USERS).get(5, TimeUnit.SECONDS);

        UpstreamRequest sent = client.requests.get(0);
        assertEquals(200, response.status());
        assertEquals(URI.create("http://127.0.0.1:9001/42?expand=true"), sent.uri());
        assertNull(sent.headers().get("host"));
        assertNull(sent.headers().get("connection"));
        assertNull(sent.headers().get("x-hop"));
        assertNull(sent.headers().get("content-length"));
        assertEquals("Bearer token", sent.headers().get("authorization"));
        assertEquals("198.51.100.1, 192.0.2.10", sent.headers().get("x-forwarded-for"));
        assertEquals("req-1", sent.headers().get("x-request-id"));
        assertEquals(0, sent.body().length);
    }

    @Test
    void forwardsBodyForMutatingMethods() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");

        executor.forward(request("POST", "/api/users/", bytes("{\"name\":\"ada\"}")), USERS).get(5, TimeUnit.SECONDS);

        UpstreamRequest sent = client.requests.get(0);
        assertEquals(URI.create("http://127.0.0.1:9001/"), sent.uri());
        assertArrayEquals(bytes("{\"name\":\"ada\"}"), sent.body());
    }

    @Test
    void retriesServerErrorsUntilSuccess() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");
        client.script.add(status(503));
        client.script.add(status(502));

        ProxyResponse response = executor.forward(request("GET", "/api/users/1", null), USERS).get(5, TimeUnit.SECONDS);

        assertEquals(200, response.status());
        assertEquals(3, response.attempts());
        RequestMetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(1, snapshot.totalRequests());
        assertEquals(1, snapshot.successCount());
        InstanceMetrics instance = snapshot.instances().get("users-1");
        assertEquals(3, instance.attempts());
        assertEquals(2, instance.failedAttempts());
    }

    @Test
    void relaysLastServerErrorOnceRetriesAreExhausted() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");
        client.fallback = status(500);

        ProxyResponse response = executor.forward(request("GET", "/api/users/1", null), USERS).get(5, TimeUnit.SECONDS);

        assertEquals(500, response.status());
        assertEquals(3, response.attempts());
        assertEquals(3, client.requests.size());
        assertEquals(1, breakers.forService("users").snapshot().failureCount());
        assertEquals(1L, metrics.snapshot().errorsByCode().get("UPSTREAM_SERVER_ERROR"));
    }

    @Test
    void clientErrorsAreRelayedWithoutRetry() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");
        client.fallback = status(404);

        ProxyResponse response = executor.forward(request("GET", "/api/users/404", null), USERS).get(5, TimeUnit.SECONDS);

        assertEquals(404, response.status());
        assertEquals(1, client.requests.size());
        assertEquals(0, breakers.forService("users").snapshot().failureCount());
        assertEquals(1, metrics.snapshot().successCount());
    }

    @Test
    void retryMovesToAnotherInstanceAfterTransportFailure() throws Exception {
        ProxyExecutor executor = executor(100, "users-1", "users-2");
        client.script.add(refused());

        ProxyResponse response = executor.forward(request("GET", "/api/users/1", null), USERS).get(5, TimeUnit.SECONDS);

        assertEquals("users-2", response.instanceId());
        assertEquals(2, response.attempts());
        assertEquals(1, tracker.record("users-1").consecutiveFailures());
        assertEquals(0, loadBalancer.connectionCount("users-1"));
    }

    @Test
    void rejectsWhenNoInstanceIsHealthy() {
        ProxyExecutor executor = executor(1, "users-1");
        tracker.recordFailure("users", "users-1", 0);

        DispatchException failure = failure(executor.forward(request("GET", "/api/users/1", null), USERS));

        assertEquals(DispatchError.NO_HEALTHY_INSTANCE, failure.error());
        assertTrue(client.requests.isEmpty());
        assertEquals(1L, metrics.snapshot().errorsByCode().get("NO_HEALTHY_INSTANCE"));
    }

    @Test
    void openCircuitRejectsWithoutCallingBackend() {
        ProxyExecutor executor = executor(100, new ProxySettings(30_000, 0, 1, 10), "users-1");
        client.fallback = refused();

        for (int i = 0; i < 5; i++) {
            DispatchException failure = failure(executor.forward(request("POST", "/api/users/charge", null), USERS));
            assertEquals(DispatchError.UPSTREAM_UNREACHABLE, failure.error());
        }
        assertEquals(CircuitState.OPEN, breakers.forService("users").state());

        DispatchException rejected = failure(executor.forward(request("POST", "/api/users/charge", null), USERS));

        assertEquals(DispatchError.CIRCUIT_OPEN, rejected.error());
        assertEquals("SERVICE_UNAVAILABLE", rejected.error().code());
        assertEquals(503, rejected.error().httpStatus());
        assertEquals(5, client.requests.size());
    }

    @Test
    void deadlineCancelsInFlightAttempt() {
        ProxyExecutor executor = executor(100, "users-1");
        Route slow = new Route("/api/users/*", "users", null, false, false, null, 50, null);
        CompletableFuture<UpstreamResponse> pending = new CompletableFuture<>();
        client.fallback = request -> pending;

        DispatchException failure = failure(executor.forward(request("GET", "/api/users/1", null), slow));

        assertEquals(DispatchError.UPSTREAM_TIMEOUT, failure.error());
        assertEquals(504, failure.error().httpStatus());
        assertTrue(pending.isCancelled());
        assertEquals(1, tracker.record("users-1").consecutiveFailures());
        assertEquals(0, loadBalancer.connectionCount("users-1"));
        assertEquals(1, breakers.forService("users").snapshot().failureCount());
    }

    @Test
    void callerCancellationAbortsAttemptWithoutBlamingInstance() {
        ProxyExecutor executor = executor(100, "users-1");
        CompletableFuture<UpstreamResponse> pending = new CompletableFuture<>();
        client.fallback = request -> pending;

        CompletableFuture<ProxyResponse> result = executor.forward(request("GET", "/api/users/1", null), USERS);
        result.cancel(true);

        assertTrue(pending.isCancelled());
        assertNull(tracker.record("users-1"));
        assertEquals(1, breakers.forService("users").snapshot().failureCount());
        assertEquals(1L, metrics.snapshot().errorsByCode().get("CLIENT_CANCELLED"));
        assertEquals(0, loadBalancer.connectionCount("users-1"));
    }

    @Test
    void retriesBackOffExponentially() throws Exception {
        scheduler.shutdownNow();
        RecordingScheduler recording = new RecordingScheduler(30_000);
        scheduler = recording;
        ProxyExecutor executor = executor(100, new ProxySettings(30_000, 3, 1000, 30_000), "users-1");
        client.fallback = status(503);

        ProxyResponse response = executor.forward(request("GET", "/api/users/1", null), USERS).get(5, TimeUnit.SECONDS);

        assertEquals(503, response.status());
        assertEquals(4, response.attempts());
        assertEquals(List.of(30_000L, 1000L, 2000L, 4000L), recording.delays);
    }

    @Test
    void malformedTargetIsRejectedWithoutTrippingCircuit() throws Exception {
        ProxyExecutor executor = executor(100, "users-1");

        for (int i = 0; i < 5; i++) {
            DispatchException failure = failure(executor.forward(request("GET", "/api/users/a|b", null), USERS));
            assertEquals(DispatchError.BAD_REQUEST, failure.error());
            assertEquals(400, failure.error().httpStatus());
        }

        assertTrue(client.requests.isEmpty());
        assertEquals(CircuitState.CLOSED, breakers.forService("users").state());
        assertEquals(0, breakers.forService("users").snapshot().failureCount());
        assertNull(tracker.record("users-1"));
        ProxyResponse response = executor.forward(
                new ProxyRequest("GET", "/api/users/1", null, new DefaultHttpHeaders(), null, "192.0.2.99", "req-2"),
                USERS).get(5, TimeUnit.SECONDS);
        assertEquals(200, response.status());
        assertEquals(5L, metrics.snapshot().errorsByCode().get("BAD_REQUEST"));
    }

    @Test
    void validatesRequestTargets() {
        assertTrue(ProxyExecutor.isValidTarget("/api/users/42", "expand=true&page=2"));
        assertTrue(ProxyExecutor.isValidTarget("/api/users/a%7Cb", null));
        assertFalse(ProxyExecutor.isValidTarget("/api/users/a|b", null));
        assertFalse(ProxyExecutor.isValidTarget("/api/users/{id}", null));
        assertFalse(ProxyExecutor.isValidTarget("/api/users", "q=a b"));
        assertFalse(ProxyExecutor.isValidTarget(null, null));
    }

    @Test
    void deadlineBeforeCallIsPublishedStillCancelsIt() {
        ProxyExecutor executor = executor(100, "users-1");
        Route slow = new Route("/api/users/*", "users", null, false, false, null, 20, null);
        CompletableFuture<UpstreamResponse> pending = new CompletableFuture<>();
        client.fallback = request -> {
            awaitBreakerFailures(1);
            return pending;
        };

        DispatchException failure = failure(executor.forward(request("GET", "/api/users/1", null), slow));

        assertEquals(DispatchError.UPSTREAM_TIMEOUT, failure.error());
        assertTrue(pending.isCancelled());
        assertEquals(0, loadBalancer.connectionCount("users-1"));
    }

    @Test
    void classifiesTransportErrors() {
        assertEquals(DispatchError.UPSTREAM_UNREACHABLE,
                ProxyExecutor.classify(new CompletionException(new ConnectException("refused"))));
        assertEquals(DispatchError.UPSTREAM_TIMEOUT, ProxyExecutor.classify(new TimeoutException()));
        assertEquals(DispatchError.INTERNAL_ERROR, ProxyExecutor.classify(new IllegalStateException()));
    }

    private ProxyExecutor executor(int failureThreshold, String... instanceIds) {
        return executor(failureThreshold, new ProxySettings(2000, 2, 1, 10), instanceIds);
    }

    private ProxyExecutor executor(int failureThreshold, ProxySettings settings, String... instanceIds) {
        registry = new ServiceRegistry((uri, timeoutMs) -> CompletableFuture.completedFuture(200));
        ServiceInstance[] instances = new ServiceInstance[instanceIds.length];
        for (int i = 0; i < instanceIds.length; i++) {
            instances[i] = new ServiceInstance(instanceIds[i], "users", "http://127.0.0.1:" + (9001 + i));
        }
        registry.registerService(ServiceDefinition.of("users"), List.of(instances));
        tracker = new InstanceHealthTracker(failureThreshold, 1);
        loadBalancer = new LoadBalancer(registry, BalancingAlgorithm.ROUND_ROBIN, tracker, null, metrics);
        breakers = new CircuitBreakerRegistry(5, Duration.ofMinutes(1), Clock.systemUTC());
        return new ProxyExecutor(registry, loadBalancer, breakers, metrics, client, scheduler, settings);
    }

    // Blocks the calling thread until the deadline has charged the breaker.
    private void awaitBreakerFailures(int expected) {
        long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (breakers.forService("users").snapshot().failureCount() < expected && System.nanoTime() < until) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static ProxyRequest request(String method, String path, byte[] body) {
        return new ProxyRequest(method, path, null, new DefaultHttpHeaders(), body, "192.0.2.10", "req");
    }

    private static DispatchException failure(CompletableFuture<ProxyResponse> future) {
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return assertInstanceOf(DispatchException.class, thrown.getCause());
    }

    private static Function<UpstreamRequest, CompletableFuture<UpstreamResponse>> status(int status) {
        return request -> CompletableFuture.completedFuture(
                new UpstreamResponse(status, new DefaultHttpHeaders(), bytes("status " + status)));
    }

    private static Function<UpstreamRequest, CompletableFuture<UpstreamResponse>> refused() {
        return request -> CompletableFuture.failedFuture(new ConnectException("Connection refused"));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static final class StubClient implements UpstreamClient {
        private final List<UpstreamRequest> requests = new CopyOnWriteArrayList<>();
        private final Deque<Function<UpstreamRequest, CompletableFuture<UpstreamResponse>>> script =
                new ConcurrentLinkedDeque<>();
        private volatile Function<UpstreamRequest, CompletableFuture<UpstreamResponse>> fallback = status(200);

        @Override
        public CompletableFuture<UpstreamResponse> execute(UpstreamRequest request) {
            requests.add(request);
            Function<UpstreamRequest, CompletableFuture<UpstreamResponse>> next = script.poll();
            return (next == null ? fallback : next).apply(request);
        }
    }

    // Records requested delays; everything shorter than the deadline runs immediately.
    private static final class RecordingScheduler extends ScheduledThreadPoolExecutor {
        private final long deadlineMs;
        private final List<Long> delays = new CopyOnWriteArrayList<>();

        private RecordingScheduler(long deadlineMs) {
            super(1);
            this.deadlineMs = deadlineMs;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            long delayMs = unit.toMillis(delay);
            delays.add(delayMs);
            return super.schedule(command, delayMs >= deadlineMs ? delayMs : 0, TimeUnit.MILLISECONDS);
        }
    }
}
