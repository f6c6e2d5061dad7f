package com.monitintel.collectors.api;

import java.util.Map;

public record CollectorResult(boolean success, String message, Map<String, Object> stats) {
    public CollectorResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static CollectorResult success(String message, Map<String, Object> stats) {
        return new CollectorResult(true, message, stats);
    }

    public static CollectorResult failure(String message, Map<String, Object> stats) {
        return new CollectorResult(false, message, stats);
    }

    public int intStat(String key) {
        Object value = stats.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }
}
