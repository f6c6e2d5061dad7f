package com.monitintel.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycleNumber,
        boolean success,
        long durationMillis,
        int criticalServices
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
