package com.txledger.application.engine;

/**
 * Execution strategy of a processing run
 */
public enum EngineType {
    SERIAL("serial"),
    STREAM("stream");

    private final String value;

    EngineType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EngineType fromValue(String value) {
        for (EngineType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown engine type: " + value);
    }
}
