package net.spookly.hygate.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Replaces {@code env:NAME} and {@code path:FILE} string values in the raw YAML tree.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    EnvExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment == null ? System::getenv : environment;
    }

    Object expand(Object value) {
        if (value instanceof Map<?, ?> raw) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue()));
            }
            return expanded;
        }
        if (value instanceof List<?> raw) {
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item));
            }
            return expanded;
        }
        if (value instanceof String raw) {
            if (raw.startsWith(ENV_PREFIX)) {
                return expandEnv(raw.substring(ENV_PREFIX.length()));
            }
            if (raw.startsWith(PATH_PREFIX)) {
                return expandPath(raw.substring(PATH_PREFIX.length()));
            }
        }
        return value;
    }

    private Object expandEnv(String key) {
        String envValue = environment.apply(key);
        if (envValue == null) {
            throw new ConfigException("Missing required environment variable: " + key);
        }
        return coerce(envValue);
    }

    private Object expandPath(String location) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved = resolvePath(location);
        try {
            String content = Files.readString(resolved, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                throw new ConfigException("Path value is empty: " + resolved);
            }
            return coerce(content);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
    }

    // Numeric and boolean settings arrive as strings from the environment.
    private Object coerce(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        if (value.matches("-?\\d{1,9}")) {
            return Integer.parseInt(value);
        }
        return value;
    }

    private Path resolvePath(String rawValue) {
        try {
            Path path = Paths.get(rawValue);
            if (baseDir != null && !path.isAbsolute()) {
                return baseDir.resolve(path).normalize();
            }
            return path;
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
