package com.pagewatch.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pagewatch.core.util.JsonUtils;
import com.pagewatch.monitor.config.EngineConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    /**
     * Reads {@code engine.json} from the config directory; a missing file yields the defaults.
     */
    public static EngineConfig loadEngine(Path configDir) {
        Path path = configDir.resolve("engine.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using engine defaults");
            return EngineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Empty config in " + path);
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
