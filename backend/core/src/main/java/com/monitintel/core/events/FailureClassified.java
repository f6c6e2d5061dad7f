package com.monitintel.core.events;

import com.monitintel.core.state.TransitionOutcome;

import java.time.Instant;

public record FailureClassified(
        Instant timestamp,
        String serviceName,
        int previousStatus,
        int status,
        TransitionOutcome outcome,
        int timesFailed
) implements Event {
    @Override
    public String type() {
        return "FailureClassified";
    }
}
