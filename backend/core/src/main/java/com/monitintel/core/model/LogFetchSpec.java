package com.monitintel.core.model;

import java.util.Objects;

/**
 * Where to look for a service's diagnostic context and how much of it to return.
 *
 * @param locator     file path, glob pattern or journal unit, depending on the strategy
 * @param maxLines    upper bound on returned lines
 * @param userJournal query the per-user journal; only meaningful for {@link LogStrategy#JOURNAL_QUERY}
 */
public record LogFetchSpec(LogStrategy strategy, String locator, int maxLines, boolean userJournal) {
    public static final int DEFAULT_MAX_LINES = 100;

    public LogFetchSpec {
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(locator, "locator is required");
        if (locator.isBlank()) {
            throw new IllegalArgumentException("locator must not be blank");
        }
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive: " + maxLines);
        }
    }

    public static LogFetchSpec of(LogStrategy strategy, String locator, int maxLines) {
        return new LogFetchSpec(strategy, locator, maxLines, false);
    }
}
