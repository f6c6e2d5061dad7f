package com.monitintel.core.events;

import java.time.Instant;
import java.util.List;

public record AnalysisHandedOff(
        Instant timestamp,
        List<String> criticalServices,
        boolean success,
        int advisoryLength
) implements Event {
    @Override
    public String type() {
        return "AnalysisHandedOff";
    }
}
