package com.txledger.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Root of application.yml
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApplicationConfig {

    @JsonProperty("engine")
    private EngineConfig engine = new EngineConfig();
}
