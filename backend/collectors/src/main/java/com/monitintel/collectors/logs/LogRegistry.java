package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogFetchSpec;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable service name to {@link LogFetchSpec} table, built once at startup.
 */
public final class LogRegistry {
    private final Map<String, LogFetchSpec> specs;

    public LogRegistry(Map<String, LogFetchSpec> specs) {
        this.specs = specs == null ? Map.of() : Map.copyOf(specs);
    }

    public static LogRegistry empty() {
        return new LogRegistry(Map.of());
    }

    public Optional<LogFetchSpec> lookup(String serviceName) {
        return Optional.ofNullable(specs.get(serviceName));
    }

    public Map<String, LogFetchSpec> asMap() {
        return new TreeMap<>(specs);
    }

    public int size() {
        return specs.size();
    }
}
