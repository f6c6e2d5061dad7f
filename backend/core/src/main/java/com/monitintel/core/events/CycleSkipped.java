package com.monitintel.core.events;

import java.time.Instant;

/**
 * Published when a scheduled tick fires while the previous cycle is still running.
 */
public record CycleSkipped(Instant timestamp, String reason) implements Event {
    @Override
    public String type() {
        return "CycleSkipped";
    }
}
