package com.txledger.infrastructure.config;

import com.txledger.application.engine.EngineType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader
 */
class ConfigLoaderTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(ConfigLoader.ENGINE_PROPERTY);
    }

    @Test
    void load_defaultResource_selectsSerialEngine() {
        ApplicationConfig config = ConfigLoader.load();

        assertEquals(EngineType.SERIAL, config.getEngine().getEngineType());
        assertEquals(10_000, config.getEngine().getWorkerDeployTimeoutMs());
        assertEquals(0, config.getEngine().getDrainTimeoutMs());
    }

    @Test
    void load_readsEngineSection() {
        EngineConfig engine = ConfigLoader.load("test-stream.yml").getEngine();

        assertEquals(EngineType.STREAM, engine.getEngineType());
        assertEquals(5_000, engine.getWorkerDeployTimeoutMs());
        assertEquals(20_000, engine.getDrainTimeoutMs());
    }

    @Test
    void load_missingResource_usesDefaults() {
        EngineConfig engine = ConfigLoader.load("does-not-exist.yml").getEngine();

        assertEquals(EngineType.SERIAL, engine.getEngineType());
        assertEquals(10_000, engine.getWorkerDeployTimeoutMs());
    }

    @Test
    void load_unknownEngineType_isRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ConfigLoader.load("test-invalid.yml"));
        assertTrue(e.getMessage().contains("engine.type"));
    }

    @Test
    void load_negativeDrainTimeout_isRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ConfigLoader.load("test-negative-drain.yml"));
        assertTrue(e.getMessage().contains("drain-timeout-ms"));
    }

    @Test
    void systemProperty_overridesEngineType() {
        System.setProperty(ConfigLoader.ENGINE_PROPERTY, "stream");

        assertEquals(EngineType.STREAM, ConfigLoader.load().getEngine().getEngineType());
    }

    @Test
    void systemProperty_withUnknownValue_isRejected() {
        System.setProperty(ConfigLoader.ENGINE_PROPERTY, "threads");

        assertThrows(IllegalStateException.class, () -> ConfigLoader.load("test-stream.yml"));
    }
}
