package com.probgraph.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigLoaderTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(ConfigLoader.CONFIG_PROPERTY);
    }

    @Test
    public void testClasspathConfigIsLoaded() {
        EngineConfig.ConfigRoot config = ConfigLoader.load();
        assertNotNull(config.inference);
        assertEquals("variable_elimination", config.inference.algorithm);
        assertEquals(10, config.learning.iterations);
        assertNull(config.seed);
    }

    @Test
    public void testSystemPropertyOverridesClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.json");
        Files.write(file, ("{\"inference\": {\"algorithm\": \"metropolis_hastings\", \"samples\": 500},"
                + " \"seed\": 42, \"comment\": \"ignored\"}").getBytes(StandardCharsets.UTF_8));
        System.setProperty(ConfigLoader.CONFIG_PROPERTY, file.toString());

        EngineConfig.ConfigRoot config = ConfigLoader.load();
        assertEquals("metropolis_hastings", config.inference.algorithm);
        assertEquals(500, config.inference.samples);
        assertNull(config.inference.burnIn);
        assertEquals(42L, config.seed);
        assertNull(config.learning);
    }

    @Test
    public void testMalformedConfigFails(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.write(file, "{\"inference\": ".getBytes(StandardCharsets.UTF_8));
        System.setProperty(ConfigLoader.CONFIG_PROPERTY, file.toString());
        assertThrows(RuntimeException.class, ConfigLoader::load);

        System.setProperty(ConfigLoader.CONFIG_PROPERTY, dir.resolve("missing.json").toString());
        assertThrows(RuntimeException.class, ConfigLoader::load);
    }

    @Test
    public void testParseFromStream() {
        InputStream is = new ByteArrayInputStream(
                "{\"inference\": {\"bpIterations\": 7, \"bpTolerance\": 0.001}}".getBytes(StandardCharsets.UTF_8));
        EngineConfig.ConfigRoot config = ConfigLoader.parse(is);
        assertEquals(7, config.inference.bpIterations);
        assertEquals(0.001, config.inference.bpTolerance, 1e-12);
        assertNull(config.inference.algorithm);
    }
}
