package com.txledger.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.txledger.application.engine.EngineType;
import lombok.Data;

/**
 * Engine section of application.yml
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    @JsonProperty("type")
    private String type = EngineType.SERIAL.getValue();

    @JsonProperty("worker-deploy-timeout-ms")
    private long workerDeployTimeoutMs = 10_000;

    @JsonProperty("drain-timeout-ms")
    private long drainTimeoutMs;  // 0 waits for workers indefinitely

    @JsonIgnore
    public EngineType getEngineType() {
        return EngineType.fromValue(type);
    }
}
