package com.pagewatch.service.config;

import com.pagewatch.monitor.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsEngineConfigAndFillsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("engine.json"), """
                {
                  "ledgerCapacity": 50,
                  "minimumInterval": "PT30S",
                  "failureThreshold": 5,
                  "resumeRunningJobs": true,
                  "annotation": {"model": "openai/gpt-4o-mini"}
                }
                """);

        EngineConfig config = ConfigLoader.loadEngine(dir);

        assertEquals(50, config.ledgerCapacity());
        assertEquals(Duration.ofSeconds(30), config.minimumInterval());
        assertEquals(Duration.ofSeconds(30), config.fetchTimeout());
        assertEquals(5, config.failureThreshold());
        assertTrue(config.resumeRunningJobs());
        assertEquals("state", config.stateDir());
        assertEquals("openai/gpt-4o-mini", config.annotation().model());
        assertEquals("https://openrouter.ai/api/v1/chat/completions", config.annotation().endpoint());
    }

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-missing-");

        assertEquals(EngineConfig.defaults(), ConfigLoader.loadEngine(dir));
    }

    @Test
    void invalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("engine.json"), "{not-json");

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadEngine(dir));
        assertTrue(invalid.getMessage().contains("engine.json"));
    }

    @Test
    void outOfRangeValuesAreRejected() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-range-");
        Files.writeString(dir.resolve("engine.json"), """
                {"ledgerCapacity": 0}
                """);

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadEngine(dir));
        assertTrue(invalid.getMessage().contains("engine.json"));
    }
}
