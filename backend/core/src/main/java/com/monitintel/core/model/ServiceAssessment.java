package com.monitintel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.monitintel.core.state.TransitionOutcome;

import java.util.Objects;
import java.util.Optional;

public record ServiceAssessment(
        String serviceName,
        int status,
        TransitionOutcome outcome,
        FailureState state,
        LogExcerpt logs
) {
    public ServiceAssessment {
        Objects.requireNonNull(serviceName, "serviceName is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(state, "state is required");
    }

    public ServiceAssessment(String serviceName, int status, TransitionOutcome outcome, FailureState state) {
        this(serviceName, status, outcome, state, null);
    }

    @JsonProperty("critical")
    public boolean critical() {
        return outcome.critical();
    }

    public Optional<LogExcerpt> logExcerpt() {
        return Optional.ofNullable(logs);
    }

    public ServiceAssessment withLogs(LogExcerpt excerpt) {
        return new ServiceAssessment(serviceName, status, outcome, state, excerpt);
    }
}
