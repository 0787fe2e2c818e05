package net.spookly.hygate.config;

/**
 * Built-in defaults and the template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String GATEWAY_HOST = "0.0.0.0";
    public static final int GATEWAY_PORT = 8080;
    public static final int MAX_CONTENT_BYTES = 10 * 1024 * 1024;

    public static final int PROXY_TIMEOUT_MS = 30_000;
    public static final int PROXY_MAX_RETRIES = 3;
    public static final int PROXY_BASE_DELAY_MS = 1_000;
    public static final int PROXY_MAX_DELAY_MS = 30_000;
    public static final int PROXY_CONNECT_TIMEOUT_MS = 5_000;

    public static final String LB_ALGORITHM = "round-robin";
    public static final int LB_FAILURE_THRESHOLD = 3;
    public static final int LB_RECOVERY_THRESHOLD = 2;
    public static final int LB_SESSION_TIMEOUT_MS = 300_000;

    public static final int HEALTH_INTERVAL_SECONDS = 30;
    public static final int HEALTH_TIMEOUT_MS = 5_000;
    public static final int HEALTH_MAX_CONCURRENCY = 8;
    public static final String HEALTH_CHECK_PATH = "/health";

    public static final int BREAKER_FAILURE_THRESHOLD = 5;
    public static final int BREAKER_RESET_TIMEOUT_MS = 60_000;

    public static final String OPS_HOST = "127.0.0.1";
    public static final int OPS_PORT = 8081;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default Hygate config.
            # Values may reference the environment with env:NAME or a file with path:FILE.
            gateway:
              listen:
                host: 0.0.0.0
                port: %d
              maxContentBytes: 10485760

            proxy:
              timeoutMs: 30000
              maxRetries: 3
              baseDelayMs: 1000
              maxDelayMs: 30000
              connectTimeoutMs: 5000

            loadBalancer:
              algorithm: round-robin
              failureThreshold: 3
              recoveryThreshold: 2
              stickySession: false
              sessionTimeoutMs: 300000

            health:
              enabled: true
              intervalSeconds: 30
              timeoutMs: 5000
              maxConcurrency: 8

            circuitBreaker:
              failureThreshold: 5
              resetTimeoutMs: 60000

            ops:
              enabled: true
              listen:
                host: 127.0.0.1
                port: %d

            services:
              - name: example-service
                healthCheckPath: /health
                retryPolicy:
                  maxRetries: 2
                  baseDelayMs: 500
                instances:
                  - id: example-1
                    url: http://127.0.0.1:9001
                    weight: 1

            routes:
              - path: /api/v1/example/*
                service: example-service
                methods: ["*"]
                requiresAuth: false
                stripPathPrefix: true
                timeoutMs: 30000
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML_TEMPLATE.formatted(GATEWAY_PORT, OPS_PORT);
    }

    /**
     * Resolve an optional integer setting, falling back when absent.
     */
    public static int intOrDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    public static boolean isTrue(Boolean value) {
        return Boolean.TRUE.equals(value);
    }
}
