package com.probgraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PROPERTY = "probgraph.config";
    public static final String CONFIG_RESOURCE = "/probgraph_config.json";

    private ConfigLoader() {
    }

    /**
     * Resolves the configuration: the file named by the
     * {@code probgraph.config} system property, then the classpath resource,
     * then an empty config.
     */
    public static EngineConfig.ConfigRoot load() {
        // 1. Check System Property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            File file = new File(path);
            try {
                EngineConfig.ConfigRoot config = mapper().readValue(file, EngineConfig.ConfigRoot.class);
                logger.info("Loaded configuration from {}", file.getAbsolutePath());
                return config;
            } catch (IOException e) {
                throw new RuntimeException("Failed to read configuration file " + path, e);
            }
        }

        // 2. Check classpath
        try (InputStream is = ConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                logger.debug("Loading configuration from classpath {}", CONFIG_RESOURCE);
                return parse(is);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read classpath configuration " + CONFIG_RESOURCE, e);
        }

        // 3. Default
        logger.warn("No configuration found, using defaults");
        return new EngineConfig.ConfigRoot();
    }

    public static EngineConfig.ConfigRoot parse(InputStream jsonStream) {
        try {
            return mapper().readValue(jsonStream, EngineConfig.ConfigRoot.class);
        } catch (IOException e) {
            throw new RuntimeException("Malformed configuration", e);
        }
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
