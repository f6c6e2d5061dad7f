package com.monitintel.service.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Latest text returned by the analysis collaborator. Kept in memory only.
 */
public record Advisory(Instant producedAt, List<String> criticalServices, String text) {
    public Advisory {
        criticalServices = criticalServices == null ? List.of() : List.copyOf(criticalServices);
        text = text == null ? "" : text;
    }
}
