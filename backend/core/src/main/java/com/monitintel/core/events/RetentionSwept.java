package com.monitintel.core.events;

import java.time.Instant;

public record RetentionSwept(Instant timestamp, Instant cutoff, int deleted) implements Event {
    @Override
    public String type() {
        return "RetentionSwept";
    }
}
