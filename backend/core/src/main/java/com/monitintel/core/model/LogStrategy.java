package com.monitintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogStrategy {
    TAIL_FILE("tail-file"),
    NEWEST_OF_GLOB("newest-of-glob"),
    JOURNAL_QUERY("journal-query");

    private final String configName;

    LogStrategy(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    @JsonCreator
    public static LogStrategy fromConfigName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (LogStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown log strategy: " + value);
    }
}
