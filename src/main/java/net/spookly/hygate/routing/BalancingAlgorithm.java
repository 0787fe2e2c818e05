package net.spookly.hygate.routing;

/**
 * Instance selection algorithm applied to the healthy instances of a service.
 */
public enum BalancingAlgorithm {
    ROUND_ROBIN("round-robin"),
    WEIGHTED_ROUND_ROBIN("weighted-round-robin"),
    LEAST_CONNECTIONS("least-connections"),
    LEAST_RESPONSE_TIME("least-response-time"),
    IP_HASH("ip-hash"),
    RANDOM("random");

    private final String configValue;

    BalancingAlgorithm(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static BalancingAlgorithm fromConfig(String value) {
        if (value == null) {
            return ROUND_ROBIN;
        }
        for (BalancingAlgorithm algorithm : values()) {
            if (algorithm.configValue.equalsIgnoreCase(value.trim())) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("unknown load balancing algorithm: " + value);
    }
}
