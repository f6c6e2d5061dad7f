package com.monitintel.core.model;

import com.monitintel.core.state.FailureClassifier;
import com.monitintel.core.state.TransitionOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Last known status and failure counters of one service. {@code firstFailureTime} marks the
 * start of the current (or most recent) failure episode.
 */
public record FailureState(
        String serviceName,
        int lastStatus,
        Instant lastChecked,
        int timesFailed,
        Instant firstFailureTime,
        Instant lastFailureTime
) {
    public FailureState {
        Objects.requireNonNull(serviceName, "serviceName is required");
        if (timesFailed < 0) {
            throw new IllegalArgumentException("timesFailed must not be negative: " + timesFailed);
        }
    }

    /**
     * Implicit state of a service that has never been classified.
     */
    public static FailureState initial(String serviceName) {
        return new FailureState(serviceName, 0, null, 0, null, null);
    }

    public boolean failing() {
        return lastStatus != 0;
    }

    public FailureState advance(TransitionOutcome outcome, int status, Instant at) {
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(at, "at is required");
        TransitionOutcome expected = FailureClassifier.classify(lastStatus, status);
        if (outcome != expected) {
            throw new IllegalStateException("Outcome " + outcome + " does not match transition "
                    + lastStatus + " -> " + status + " for " + serviceName + " (expected " + expected + ")");
        }
        return switch (outcome) {
            case HEALTHY, RECOVERED -> new FailureState(serviceName, status, at, timesFailed, firstFailureTime, lastFailureTime);
            case NEW -> new FailureState(serviceName, status, at, timesFailed + 1, at, at);
            case ONGOING -> new FailureState(serviceName, lastStatus, at, timesFailed, firstFailureTime, lastFailureTime);
            case CHANGED -> new FailureState(serviceName, status, at, timesFailed + 1, firstFailureTime, at);
        };
    }
}
