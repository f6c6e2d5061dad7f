package com.monitintel.core.events;

import java.time.Instant;

public record SnapshotsIngested(Instant timestamp, int persisted, int skipped) implements Event {
    @Override
    public String type() {
        return "SnapshotsIngested";
    }
}
