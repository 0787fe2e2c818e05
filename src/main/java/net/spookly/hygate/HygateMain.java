package net.spookly.hygate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.hygate.breaker.CircuitBreakerRegistry;
import net.spookly.hygate.config.ConfigDefaults;
import net.spookly.hygate.config.ConfigLoader;
import net.spookly.hygate.config.ConfigPrinter;
import net.spookly.hygate.config.ConfigWarnings;
import net.spookly.hygate.config.HygateConfig;
import net.spookly.hygate.event.AuditLogListener;
import net.spookly.hygate.event.DispatchEventPublisher;
import net.spookly.hygate.metrics.MetricsAggregator;
import net.spookly.hygate.ops.OpsServer;
import net.spookly.hygate.proxy.GatewayServer;
import net.spookly.hygate.proxy.HttpHealthProbe;
import net.spookly.hygate.proxy.NettyUpstreamClient;
import net.spookly.hygate.proxy.ProxyExecutor;
import net.spookly.hygate.proxy.ProxySettings;
import net.spookly.hygate.proxy.RouteRateLimiter;
import net.spookly.hygate.registry.ServiceRegistry;
import net.spookly.hygate.routing.HealthCheckService;
import net.spookly.hygate.routing.InstanceHealthTracker;
import net.spookly.hygate.routing.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the Hygate gateway process.
 */
public final class HygateMain {
    private static final Logger LOG = LoggerFactory.getLogger(HygateMain.class);
    private static final String DEFAULT_CONFIG = "config/hygate.yaml";

    private HygateMain() {
    }

    /**
     * Boot the gateway listener, health checks and the optional ops API.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        HygateConfig config = ConfigLoader.load(options.configPath);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        Clock clock = Clock.systemUTC();
        DispatchEventPublisher events = new DispatchEventPublisher(AuditLogListener.INSTANCE);
        MetricsAggregator metrics = new MetricsAggregator(clock);
        EventLoopGroup workerGroup = new NioEventLoopGroup();

        HygateConfig.ProxyConfig proxy = config.proxy == null ? new HygateConfig.ProxyConfig() : config.proxy;
        HygateConfig.GatewayConfig gateway = config.gateway == null ? new HygateConfig.GatewayConfig() : config.gateway;
        int maxContentBytes = ConfigDefaults.intOrDefault(gateway.maxContentBytes, ConfigDefaults.MAX_CONTENT_BYTES);
        NettyUpstreamClient upstream = new NettyUpstreamClient(workerGroup,
                ConfigDefaults.intOrDefault(proxy.connectTimeoutMs, ConfigDefaults.PROXY_CONNECT_TIMEOUT_MS),
                maxContentBytes);

        ServiceRegistry registry = ServiceRegistry.fromConfig(config, new HttpHealthProbe(upstream), events, clock);
        InstanceHealthTracker healthTracker = InstanceHealthTracker.fromConfig(config, events, clock);
        LoadBalancer loadBalancer = LoadBalancer.fromConfig(config, registry, healthTracker, metrics, clock);
        if (loadBalancer.sessions() != null) {
            loadBalancer.sessions().start();
        }
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.fromConfig(config, clock, events);
        ProxyExecutor executor = new ProxyExecutor(registry, loadBalancer, breakers, metrics, upstream, workerGroup,
                ProxySettings.fromConfig(config));
        LOG.info("Hygate config loaded: {} service(s), {} route(s), algorithm={}",
                registry.getAllServices().size(), registry.getAllRoutes().size(), loadBalancer.algorithm().configValue());

        String host = ConfigDefaults.GATEWAY_HOST;
        int port = ConfigDefaults.GATEWAY_PORT;
        if (gateway.listen != null) {
            host = gateway.listen.host;
            port = gateway.listen.port;
        }
        GatewayServer gatewayServer = new GatewayServer(host, port, maxContentBytes, registry, executor,
                new RouteRateLimiter(clock), workerGroup);
        gatewayServer.start();

        HealthCheckService healthChecks = HealthCheckService.fromConfig(config, registry, healthTracker, loadBalancer);
        if (config.health == null || config.health.enabled == null || config.health.enabled) {
            healthChecks.start();
        }

        OpsServer opsServer = null;
        if (config.ops != null && ConfigDefaults.isTrue(config.ops.enabled)) {
            opsServer = new OpsServer(config.ops.listen.host, config.ops.listen.port, registry, loadBalancer,
                    healthChecks, breakers, metrics, clock);
            opsServer.start();
        }

        CountDownLatch latch = new CountDownLatch(1);
        OpsServer finalOpsServer = opsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down");
            healthChecks.stop();
            if (finalOpsServer != null) {
                finalOpsServer.stop();
            }
            gatewayServer.stop();
            if (loadBalancer.sessions() != null) {
                loadBalancer.sessions().stop();
            }
            workerGroup.shutdownGracefully();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (("--config".equals(arg) || "-c".equals(arg)) && i + 1 < args.length) {
                configPath = Paths.get(args[++i]);
                continue;
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(HygateConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            LOG.warn("Config warning: {}", warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
