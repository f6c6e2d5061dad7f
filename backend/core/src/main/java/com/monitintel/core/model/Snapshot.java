package com.monitintel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of one service. The payload is the raw status entry as JSON and is never
 * interpreted.
 */
public record Snapshot(String serviceName, Instant observedAt, int status, String payload) {
    public Snapshot {
        Objects.requireNonNull(serviceName, "serviceName is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        if (serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        payload = payload == null ? "{}" : payload;
    }

    public boolean healthy() {
        return status == 0;
    }
}
