package com.monitintel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.monitintel.collectors.logs.LogRegistry;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;
import com.monitintel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    public static final String MONITOR_FILE = "monitor.json";
    public static final String LOG_REGISTRY_FILE = "log-registry.json";
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static MonitorConfig loadMonitor(Path configDir) {
        return read(configDir.resolve(MONITOR_FILE), new TypeReference<>() {
        });
    }

    /**
     * Reads the service to log source table. A missing file yields an empty registry, leaving
     * every service to the journal fallback.
     */
    public static LogRegistry loadLogRegistry(Path configDir) {
        Path path = configDir.resolve(LOG_REGISTRY_FILE);
        if (!Files.exists(path)) {
            LOGGER.warning("No log registry at " + path + "; relying on journal fallback");
            return LogRegistry.empty();
        }
        Map<String, RegistryEntry> entries = read(path, new TypeReference<LinkedHashMap<String, RegistryEntry>>() {
        });
        Map<String, LogFetchSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, RegistryEntry> entry : entries.entrySet()) {
            try {
                specs.put(entry.getKey(), entry.getValue().toSpec());
            } catch (RuntimeException e) {
                throw new IllegalStateException("Invalid log registry entry '" + entry.getKey() + "' in " + path, e);
            }
        }
        return new LogRegistry(specs);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    record RegistryEntry(LogStrategy strategy, String locator, Integer maxLines, Boolean userJournal) {
        LogFetchSpec toSpec() {
            return new LogFetchSpec(
                    strategy,
                    locator,
                    maxLines == null ? LogFetchSpec.DEFAULT_MAX_LINES : maxLines,
                    Boolean.TRUE.equals(userJournal)
            );
        }
    }
}
