package com.monitintel.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Degraded source or failed stage. Category is one of {@code source}, {@code input},
 * {@code store} or {@code pipeline}.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
