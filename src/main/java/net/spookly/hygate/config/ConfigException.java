package net.spookly.hygate.config;

/**
 * Raised when the gateway configuration cannot be read, bound or validated.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
