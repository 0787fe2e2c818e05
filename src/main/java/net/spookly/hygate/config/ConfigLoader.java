package net.spookly.hygate.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the Hygate YAML configuration.
     */
    public static HygateConfig load(Path path) {
        return load(path, System::getenv);
    }

    static HygateConfig load(Path path, Function<String, String> environment) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (Files.notExists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("No config at " + path + ", generated default; review it and restart");
        }
        Object tree = new EnvExpander(path.toAbsolutePath().getParent(), environment).expand(readYaml(path));
        HygateConfig config = bind(tree, path);
        ConfigValidator.validate(config);
        LOG.debug("Loaded {} services and {} routes from {}",
                config.services == null ? 0 : config.services.size(),
                config.routes == null ? 0 : config.routes.size(),
                path);
        return config;
    }

    private static Object readYaml(Path path) {
        Object document;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Unable to read config " + path, e);
        }
        if (document == null) {
            throw new ConfigException("Config " + path + " has no content");
        }
        return document;
    }

    private static HygateConfig bind(Object tree, Path path) {
        try {
            return MAPPER.convertValue(tree, HygateConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config " + path + ": " + e.getMessage(), e);
        }
    }

    private static void writeDefaultConfig(Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            LOG.info("Wrote default config to {}", path);
        } catch (IOException e) {
            throw new ConfigException("Unable to write default config " + path, e);
        }
    }
}
