package com.txledger.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.txledger.application.engine.EngineType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads application.yml from the classpath.
 * The system property {@value #ENGINE_PROPERTY} overrides engine.type.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "application.yml";
    public static final String ENGINE_PROPERTY = "ledger.engine";

    private static final ObjectMapper YAML = new YAMLMapper();

    private ConfigLoader() {
    }

    public static ApplicationConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ApplicationConfig load(String resource) {
        ApplicationConfig config;
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("{} not found in classpath, using defaults", resource);
                config = new ApplicationConfig();
            } else {
                config = YAML.readValue(is, ApplicationConfig.class);
                log.debug("Loaded configuration from {}", resource);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }

        if (config.getEngine() == null) {
            config.setEngine(new EngineConfig());
        }

        String override = System.getProperty(ENGINE_PROPERTY);
        if (override != null && !override.isBlank()) {
            log.info("Engine type overridden by -D{}={}", ENGINE_PROPERTY, override);
            config.getEngine().setType(override.trim());
        }

        validate(config.getEngine());
        return config;
    }

    private static void validate(EngineConfig engine) {
        try {
            EngineType.fromValue(engine.getType());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Configuration error: engine.type must be serial or stream", e);
        }
        if (engine.getWorkerDeployTimeoutMs() <= 0) {
            throw new IllegalStateException("Configuration error: engine.worker-deploy-timeout-ms must be positive");
        }
        if (engine.getDrainTimeoutMs() < 0) {
            throw new IllegalStateException("Configuration error: engine.drain-timeout-ms must not be negative");
        }
    }
}
