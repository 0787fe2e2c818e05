package net.spookly.hygate.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.registry.HealthCheckResult;
import net.spookly.hygate.registry.ServiceInstance;
import net.spookly.hygate.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically health-checks every registered instance with bounded concurrency and feeds the
 * results into the shared health tracker.
 */
public final class HealthCheckService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HealthCheckService.class);

    private final ServiceRegistry registry;
    private final InstanceHealthTracker healthTracker;
    private final LoadBalancer loadBalancer;
    private final int intervalSeconds;
    private final int maxConcurrency;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    public HealthCheckService(ServiceRegistry registry,
                              InstanceHealthTracker healthTracker,
                              int intervalSeconds,
                              int maxConcurrency) {
        this(registry, healthTracker, null, intervalSeconds, maxConcurrency);
    }

    /**
     * @param loadBalancer pruned of removed instances at the start of every round; may be null
     */
    public HealthCheckService(ServiceRegistry registry,
                              InstanceHealthTracker healthTracker,
                              LoadBalancer loadBalancer,
                              int intervalSeconds,
                              int maxConcurrency) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.loadBalancer = loadBalancer;
        this.intervalSeconds = intervalSeconds;
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    public static HealthCheckService fromConfig(HygateConfig config,
                                                ServiceRegistry registry,
                                                InstanceHealthTracker healthTracker,
                                                LoadBalancer loadBalancer) {
        HygateConfig.HealthConfig health = config.health == null ? new HygateConfig.HealthConfig() : config.health;
        return new HealthCheckService(registry, healthTracker, loadBalancer,
                ConfigDefaults.intOrDefault(health.intervalSeconds, ConfigDefaults.HEALTH_INTERVAL_SECONDS),
                ConfigDefaults.intOrDefault(health.maxConcurrency, ConfigDefaults.HEALTH_MAX_CONCURRENCY));
    }

    /**
     * Start the periodic check loop. The first round runs after one interval so that a cold start
     * keeps serving every instance under the assume-healthy default.
     */
    public void start() {
        if (stopped.get() || scheduledTask != null || intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::runScheduled, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("Health checks every {}s (max {} concurrent)", intervalSeconds, maxConcurrency);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check every registered instance once. Completes when all checks have finished; a round
     * requested while another is in progress completes immediately with no results.
     */
    public CompletableFuture<List<HealthCheckResult>> runOnce() {
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Skipping health round, previous round still running");
            return CompletableFuture.completedFuture(List.of());
        }
        List<ServiceInstance> instances = registry.getAllInstances();
        List<String> ids = new ArrayList<>(instances.size());
        for (ServiceInstance instance : instances) {
            ids.add(instance.id());
        }
        healthTracker.retain(ids);
        if (loadBalancer != null) {
            loadBalancer.retainInstances(ids);
        }
        return checkAll(instances).whenComplete((results, error) -> running.set(false));
    }

    /**
     * Check the instances of one service on demand.
     */
    public CompletableFuture<List<HealthCheckResult>> checkService(String serviceName) {
        return checkAll(registry.getInstances(serviceName));
    }

    private void runScheduled() {
        if (stopped.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOG.error("Health round failed", e);
        }
    }

    private CompletableFuture<List<HealthCheckResult>> checkAll(List<ServiceInstance> instances) {
        if (instances.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        Queue<ServiceInstance> pending = new ConcurrentLinkedQueue<>(instances);
        Queue<HealthCheckResult> results = new ConcurrentLinkedQueue<>();
        int workers = Math.min(maxConcurrency, instances.size());
        CompletableFuture<?>[] lanes = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            lanes[i] = drain(pending, results);
        }
        return CompletableFuture.allOf(lanes).thenApply(ignored -> new ArrayList<>(results));
    }

    // Each lane checks one instance at a time until the queue is empty.
    private CompletableFuture<Void> drain(Queue<ServiceInstance> pending, Queue<HealthCheckResult> results) {
        ServiceInstance next = pending.poll();
        if (next == null) {
            return CompletableFuture.completedFuture(null);
        }
        return check(next).thenCompose(result -> {
            results.add(result);
            return drain(pending, results);
        });
    }

    private CompletableFuture<HealthCheckResult> check(ServiceInstance instance) {
        CompletableFuture<HealthCheckResult> check;
        try {
            check = registry.checkHealth(instance.id());
        } catch (IllegalArgumentException e) {
            // Unregistered between listing and checking.
            return CompletableFuture.completedFuture(new HealthCheckResult(instance.id(), instance.serviceName(),
                    false, 0, 0, e.getMessage(), null));
        }
        return check.thenApply(result -> {
            if (result.healthy()) {
                healthTracker.recordSuccess(instance.serviceName(), instance.id(), result.responseTimeMs());
            } else {
                healthTracker.recordFailure(instance.serviceName(), instance.id(), result.responseTimeMs());
            }
            return result;
        });
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "hygate-health-check");
            thread.setDaemon(true);
            return thread;
        };
    }
}
