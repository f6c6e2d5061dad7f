package com.monitintel.service.pipeline;

import com.monitintel.collectors.api.SnapshotStore;
import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.FailureClassified;
import com.monitintel.core.model.FailureState;
import com.monitintel.core.model.ServiceAssessment;
import com.monitintel.core.model.Snapshot;
import com.monitintel.core.state.FailureClassifier;
import com.monitintel.core.state.TransitionOutcome;
import com.monitintel.service.store.FailureStateStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies the newest snapshot of each service against its stored {@link FailureState}. A
 * snapshot that is not newer than {@code lastChecked} has already been assessed and is skipped.
 */
public class FailureStateTracker {
    private static final Logger LOGGER = Logger.getLogger(FailureStateTracker.class.getName());

    private final SnapshotStore snapshots;
    private final FailureStateStore states;
    private final EventBus eventBus;
    private final Clock clock;

    public FailureStateTracker(SnapshotStore snapshots, FailureStateStore states, EventBus eventBus, Clock clock) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
        this.states = Objects.requireNonNull(states, "states is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public List<ServiceAssessment> assessFresh() {
        List<ServiceAssessment> assessments = new ArrayList<>();
        for (Snapshot latest : snapshots.latestPerService()) {
            try {
                assess(latest, assessments);
            } catch (IllegalStateException e) {
                LOGGER.log(Level.WARNING, "Failed assessing " + latest.serviceName() + "; retrying next cycle", e);
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        "store",
                        "Failed assessing " + latest.serviceName() + ": " + e.getMessage(),
                        Map.of("service", latest.serviceName())
                ));
            }
        }
        return assessments;
    }

    private void assess(Snapshot latest, List<ServiceAssessment> assessments) {
        FailureState previous = states.find(latest.serviceName())
                .orElseGet(() -> FailureState.initial(latest.serviceName()));
        if (previous.lastChecked() != null && !latest.observedAt().isAfter(previous.lastChecked())) {
            return;
        }
        TransitionOutcome outcome = FailureClassifier.classify(previous.lastStatus(), latest.status());
        FailureState next = previous.advance(outcome, latest.status(), latest.observedAt());
        states.upsert(next);

        if (outcome != TransitionOutcome.HEALTHY) {
            LOGGER.info(latest.serviceName() + ": " + outcome + " (" + previous.lastStatus() + " -> "
                    + latest.status() + ", timesFailed=" + next.timesFailed() + ")");
        }
        eventBus.publish(new FailureClassified(
                clock.instant(),
                latest.serviceName(),
                previous.lastStatus(),
                latest.status(),
                outcome,
                next.timesFailed()
        ));
        assessments.add(new ServiceAssessment(latest.serviceName(), latest.status(), outcome, next));
    }
}
