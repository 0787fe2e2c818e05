package net.spookly.hygate.proxy;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.hygate.breaker.CircuitBreaker;
import net.spookly.hygate.breaker.CircuitBreakerRegistry;
import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.metrics.RequestOutcome;
import net.spookly.hygate.registry.Route;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import net.spookly.hygate.routing.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards a request to an instance of the route's service with retries, exponential backoff and
 * an overall deadline.
 * <p>
 * The circuit breaker and the metrics aggregator see one outcome per request. The load balancer
 * sees one outcome per network attempt, except for attempts aborted because the caller went away.
 */
public final class ProxyExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ProxyExecutor.class);
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final String REQUEST_ID = "x-request-id";

    private final ServiceRegistry registry;
    private final LoadBalancer loadBalancer;
    private final CircuitBreakerRegistry breakers;
    private final MetricsAggregator metrics;
    private final UpstreamClient client;
    private final ScheduledExecutorService scheduler;
    private final ProxySettings settings;

    /**
     * @param scheduler runs backoff delays and deadlines; in the gateway this is the Netty event loop group
     */
    public ProxyExecutor(ServiceRegistry registry,
                         LoadBalancer loadBalancer,
                         CircuitBreakerRegistry breakers,
                         MetricsAggregator metrics,
                         UpstreamClient client,
                         ScheduledExecutorService scheduler,
                         ProxySettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "loadBalancer");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.client = Objects.requireNonNull(client, "client");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = settings == null ? ProxySettings.defaults() : settings;
    }

    /**
     * Forward the request. The future completes with the relayed backend response (2xx to 4xx, or
     * the last 5xx/429 once retries are exhausted) or exceptionally with a {@link DispatchException}.
     * Cancelling the future aborts the in-flight attempt and stops further retries.
     */
    public CompletableFuture<ProxyResponse> forward(ProxyRequest request, Route route) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(route, "route");
        String serviceName = route.targetService();
        long started = System.nanoTime();
        if (!isValidTarget(request.path(), request.rawQuery())) {
            metrics.record(serviceName, null, RequestOutcome.FAILURE, millisSince(started),
                    DispatchError.BAD_REQUEST.code());
            LOG.debug("Rejecting request {} with malformed target {}", request.requestId(), request.path());
            return CompletableFuture.failedFuture(new DispatchException(DispatchError.BAD_REQUEST,
                    "Request target is not a valid URI"));
        }
        ServiceInstance instance = loadBalancer.selectInstance(serviceName, request.clientKey());
        if (instance == null) {
            metrics.record(serviceName, null, RequestOutcome.FAILURE, millisSince(started),
                    DispatchError.NO_HEALTHY_INSTANCE.code());
            LOG.warn("No healthy instance for {} (request {})", serviceName, request.requestId());
            return CompletableFuture.failedFuture(new DispatchException(DispatchError.NO_HEALTHY_INSTANCE,
                    "No healthy instance available for service " + serviceName));
        }
        CircuitBreaker breaker = breakers.forService(serviceName);
        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (permit == null) {
            metrics.record(serviceName, null, RequestOutcome.FAILURE, millisSince(started),
                    DispatchError.CIRCUIT_OPEN.code());
            LOG.debug("Circuit open for {}, rejecting request {}", serviceName, request.requestId());
            return CompletableFuture.failedFuture(new DispatchException(DispatchError.CIRCUIT_OPEN,
                    "Service " + serviceName + " is temporarily unavailable"));
        }
        Dispatch dispatch = new Dispatch(request, route, breaker, permit,
                settings.resolve(route, registry.getService(serviceName)), started);
        dispatch.begin(instance);
        return dispatch.result;
    }

    /**
     * Outbound request for one attempt: prefix stripped when the route asks for it, hop-by-hop
     * headers removed, tracking headers set, body kept for mutating methods only.
     */
    UpstreamRequest buildUpstreamRequest(ProxyRequest request, Route route, ServiceInstance instance) {
        URI target = instance.resolve(route.targetPath(request.path()), request.rawQuery());
        HttpHeaders headers = HopByHopHeaders.strip(request.headers());
        headers.remove(HttpHeaderNames.HOST);
        headers.remove(HttpHeaderNames.CONTENT_LENGTH);
        if (request.requestId() != null) {
            headers.set(REQUEST_ID, request.requestId());
        }
        if (request.clientKey() != null) {
            String forwarded = headers.get("x-forwarded-for");
            headers.set("x-forwarded-for", forwarded == null || forwarded.isBlank()
                    ? request.clientKey()
                    : forwarded + ", " + request.clientKey());
        }
        String method = request.method().toUpperCase(Locale.ROOT);
        byte[] body = BODY_METHODS.contains(method) && request.body() != null ? request.body() : new byte[0];
        return new UpstreamRequest(method, target, headers, body);
    }

    /**
     * True when the path and raw query can be carried in an upstream URI unchanged.
     */
    static boolean isValidTarget(String path, String rawQuery) {
        if (path == null) {
            return false;
        }
        try {
            new URI(rawQuery == null ? path : path + '?' + rawQuery);
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static DispatchError classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DispatchException) {
            return ((DispatchException) cause).error();
        }
        if (cause instanceof TimeoutException || cause instanceof io.netty.handler.timeout.TimeoutException) {
            return DispatchError.UPSTREAM_TIMEOUT;
        }
        if (cause instanceof ConnectException || cause instanceof UnknownHostException || cause instanceof IOException) {
            return DispatchError.UPSTREAM_UNREACHABLE;
        }
        return DispatchError.INTERNAL_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * One network attempt. Whichever of the response callback, the deadline or a caller
     * cancellation settles it first owns its accounting.
     */
    private static final class Attempt {
        private final int number;
        private final ServiceInstance instance;
        private final long startedNanos = System.nanoTime();
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private volatile CompletableFuture<UpstreamResponse> call;

        private Attempt(int number, ServiceInstance instance) {
            this.number = number;
            this.instance = instance;
        }

        private boolean settle() {
            return settled.compareAndSet(false, true);
        }
    }

    private final class Dispatch {
        private final ProxyRequest request;
        private final Route route;
        private final String serviceName;
        private final CircuitBreaker breaker;
        private final CircuitBreaker.Permit permit;
        private final ProxySettings.Resolved resolved;
        private final long startedNanos;
        private final CompletableFuture<ProxyResponse> result = new CompletableFuture<>();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile Attempt current;
        private volatile ScheduledFuture<?> deadline;

        private Dispatch(ProxyRequest request,
                         Route route,
                         CircuitBreaker breaker,
                         CircuitBreaker.Permit permit,
                         ProxySettings.Resolved resolved,
                         long startedNanos) {
            this.request = request;
            this.route = route;
            this.serviceName = route.targetService();
            this.breaker = breaker;
            this.permit = permit;
            this.resolved = resolved;
            this.startedNanos = startedNanos;
        }

        private void begin(ServiceInstance instance) {
            result.whenComplete((response, error) -> {
                if (result.isCancelled()) {
                    onCallerCancelled();
                }
            });
            try {
                deadline = scheduler.schedule(this::onDeadline, resolved.timeoutMs(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                fail(new DispatchException(DispatchError.INTERNAL_ERROR, "Gateway is shutting down", e));
                return;
            }
            attempt(0, instance);
        }

        private void attempt(int number, ServiceInstance instance) {
            if (finished.get()) {
                return;
            }
            Attempt attempt = new Attempt(number, instance);
            current = attempt;
            UpstreamRequest upstream;
            try {
                upstream = buildUpstreamRequest(request, route, instance);
            } catch (IllegalArgumentException e) {
                attempt.settle();
                LOG.error("Could not build upstream request {} for {}", request.requestId(), instance, e);
                fail(new DispatchException(DispatchError.INTERNAL_ERROR, "Internal server error", e));
                return;
            }
            loadBalancer.recordConnectionStart(instance.id());
            CompletableFuture<UpstreamResponse> call;
            try {
                call = client.execute(upstream);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            attempt.call = call;
            if (finished.get()) {
                // Deadline or caller cancellation ran before the call was published.
                call.cancel(true);
            }
            call.whenComplete((response, error) -> {
                loadBalancer.recordConnectionEnd(instance.id());
                if (!attempt.settle()) {
                    return;
                }
                long elapsedMs = millisSince(attempt.startedNanos);
                if (error != null) {
                    onTransportFailure(attempt, error, elapsedMs);
                } else {
                    onResponse(attempt, response, elapsedMs);
                }
            });
        }

        private void onResponse(Attempt attempt, UpstreamResponse response, long elapsedMs) {
            int status = response.status();
            if (status >= 500 || status == 429) {
                loadBalancer.recordFailure(attempt.instance.id(), elapsedMs);
                if (attempt.number < resolved.maxRetries()) {
                    LOG.debug("Attempt {} to {} returned {}, retrying", attempt.number, attempt.instance, status);
                    retryLater(attempt, new Failure(response, null));
                    return;
                }
                relayFailure(attempt, response);
                return;
            }
            loadBalancer.recordSuccess(attempt.instance.id(), elapsedMs);
            succeed(attempt, response);
        }

        private void onTransportFailure(Attempt attempt, Throwable error, long elapsedMs) {
            DispatchError kind = classify(error);
            loadBalancer.recordFailure(attempt.instance.id(), elapsedMs);
            DispatchException failure = toDispatchException(kind, unwrap(error));
            if (kind.retryable() && attempt.number < resolved.maxRetries()) {
                LOG.debug("Attempt {} to {} failed ({}), retrying", attempt.number, attempt.instance, kind);
                retryLater(attempt, new Failure(null, failure));
                return;
            }
            fail(failure);
        }

        private void retryLater(Attempt previous, Failure last) {
            long delayMs = resolved.backoff().delayMs(previous.number);
            Runnable retry = () -> {
                if (finished.get()) {
                    return;
                }
                try {
                    ServiceInstance next = loadBalancer.selectInstance(serviceName, request.clientKey());
                    if (next == null) {
                        LOG.debug("No healthy instance left for {} after attempt {}", serviceName, previous.number);
                        surface(previous, last);
                        return;
                    }
                    attempt(previous.number + 1, next);
                } catch (RuntimeException e) {
                    LOG.error("Retry of request {} failed unexpectedly", request.requestId(), e);
                    fail(new DispatchException(DispatchError.INTERNAL_ERROR, "Internal server error", e));
                }
            };
            try {
                scheduler.schedule(retry, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                surface(previous, last);
            }
        }

        private void surface(Attempt attempt, Failure last) {
            if (last.response != null) {
                relayFailure(attempt, last.response);
            } else {
                fail(last.error);
            }
        }

        private void succeed(Attempt attempt, UpstreamResponse response) {
            if (!finish()) {
                return;
            }
            breaker.recordSuccess(permit);
            metrics.record(serviceName, attempt.instance.id(), RequestOutcome.SUCCESS, millisSince(startedNanos));
            result.complete(toProxyResponse(response, attempt));
        }

        private void relayFailure(Attempt attempt, UpstreamResponse response) {
            if (!finish()) {
                return;
            }
            breaker.recordFailure(permit);
            metrics.record(serviceName, attempt.instance.id(), RequestOutcome.FAILURE, millisSince(startedNanos),
                    DispatchError.UPSTREAM_SERVER_ERROR.code());
            LOG.warn("Relaying status {} from {} for {} after {} attempt(s)",
                    response.status(), attempt.instance, serviceName, attempt.number + 1);
            result.complete(toProxyResponse(response, attempt));
        }

        private void fail(DispatchException failure) {
            if (!finish()) {
                return;
            }
            Attempt attempt = current;
            breaker.recordFailure(permit);
            metrics.record(serviceName, attempt == null ? null : attempt.instance.id(), RequestOutcome.FAILURE,
                    millisSince(startedNanos), failure.error().code());
            LOG.warn("Dispatch to {} via {} failed: {} ({})", serviceName,
                    attempt == null ? "-" : attempt.instance.id(), failure.error().code(), failure.getMessage());
            result.completeExceptionally(failure);
        }

        private void onDeadline() {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            Attempt attempt = current;
            if (attempt != null && attempt.settle()) {
                loadBalancer.recordFailure(attempt.instance.id(), millisSince(attempt.startedNanos));
                cancel(attempt);
            }
            breaker.recordFailure(permit);
            metrics.record(serviceName, attempt == null ? null : attempt.instance.id(), RequestOutcome.FAILURE,
                    millisSince(startedNanos), DispatchError.UPSTREAM_TIMEOUT.code());
            LOG.warn("Request {} to {} exceeded its {}ms deadline", request.requestId(), serviceName, resolved.timeoutMs());
            result.completeExceptionally(new DispatchException(DispatchError.UPSTREAM_TIMEOUT,
                    "Upstream service " + serviceName + " did not respond within " + resolved.timeoutMs() + "ms"));
        }

        // Caller-side aborts count against the breaker but not the instance's failure streak.
        private void onCallerCancelled() {
            if (!finish()) {
                return;
            }
            Attempt attempt = current;
            if (attempt != null && attempt.settle()) {
                cancel(attempt);
            }
            breaker.recordFailure(permit);
            metrics.record(serviceName, attempt == null ? null : attempt.instance.id(), RequestOutcome.FAILURE,
                    millisSince(startedNanos), DispatchError.CLIENT_CANCELLED.code());
            LOG.debug("Request {} to {} cancelled by the caller", request.requestId(), serviceName);
        }

        private boolean finish() {
            if (!finished.compareAndSet(false, true)) {
                return false;
            }
            ScheduledFuture<?> timer = deadline;
            if (timer != null) {
                timer.cancel(false);
            }
            return true;
        }

        private void cancel(Attempt attempt) {
            CompletableFuture<UpstreamResponse> call = attempt.call;
            if (call != null) {
                call.cancel(true);
            }
        }

        private ProxyResponse toProxyResponse(UpstreamResponse response, Attempt attempt) {
            HttpHeaders headers = HopByHopHeaders.strip(response.headers());
            headers.remove(HttpHeaderNames.CONTENT_LENGTH);
            return new ProxyResponse(response.status(), headers, response.body(), attempt.instance.id(), attempt.number + 1);
        }

        private DispatchException toDispatchException(DispatchError kind, Throwable cause) {
            if (cause instanceof DispatchException) {
                return (DispatchException) cause;
            }
            if (kind == DispatchError.UPSTREAM_TIMEOUT) {
                return new DispatchException(kind, "Upstream service " + serviceName + " timed out", cause);
            }
            if (kind == DispatchError.UPSTREAM_UNREACHABLE) {
                return new DispatchException(kind, "Upstream service " + serviceName + " is unreachable", cause);
            }
            LOG.error("Unexpected failure forwarding request {} to {}", request.requestId(), serviceName, cause);
            return new DispatchException(DispatchError.INTERNAL_ERROR, "Internal server error", cause);
        }
    }

    private static final class Failure {
        private final UpstreamResponse response;
        private final DispatchException error;

        private Failure(UpstreamResponse response, DispatchException error) {
            this.response = response;
            this.error = error;
        }
    }
}
