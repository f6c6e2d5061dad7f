package com.monitintel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Bounded block of log lines fetched for one service. An empty excerpt always carries a reason.
 */
public record LogExcerpt(
        String serviceName,
        LogStrategy strategy,
        String source,
        List<String> lines,
        String reason
) {
    public LogExcerpt {
        Objects.requireNonNull(serviceName, "serviceName is required");
        lines = lines == null ? List.of() : List.copyOf(lines);
        if (lines.isEmpty() && (reason == null || reason.isBlank())) {
            reason = "no log lines returned";
        }
    }

    public static LogExcerpt of(String serviceName, LogStrategy strategy, String source, List<String> lines) {
        return new LogExcerpt(serviceName, strategy, source, lines, null);
    }

    public static LogExcerpt empty(String serviceName, LogStrategy strategy, String source, String reason) {
        return new LogExcerpt(serviceName, strategy, source, List.of(), reason);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String text() {
        return String.join("\n", lines);
    }
}
