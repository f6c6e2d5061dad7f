package com.monitintel.service.pipeline;

import com.monitintel.collectors.logs.LogAggregator;
import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.AnalysisHandedOff;
import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.ServiceAssessment;
import com.monitintel.core.model.WorkflowContext;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detect, fetch logs for critical services only, then hand the bundle to the analysis client once.
 * A failed handoff is reported and not retried.
 */
public class DetectionPipeline {
    private static final Logger LOGGER = Logger.getLogger(DetectionPipeline.class.getName());

    private final FailureStateTracker tracker;
    private final LogAggregator logAggregator;
    private final AnalysisClient analysisClient;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicReference<Advisory> latestAdvisory = new AtomicReference<>();

    public DetectionPipeline(
            FailureStateTracker tracker,
            LogAggregator logAggregator,
            AnalysisClient analysisClient,
            EventBus eventBus,
            Clock clock
    ) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
        this.logAggregator = Objects.requireNonNull(logAggregator, "logAggregator is required");
        this.analysisClient = Objects.requireNonNull(analysisClient, "analysisClient is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public PipelineRun run() {
        Instant cycleAt = clock.instant();
        List<ServiceAssessment> assessments = tracker.assessFresh();
        WorkflowContext context = WorkflowContext.of(cycleAt, assessments);
        List<String> critical = context.criticalServices();
        if (critical.isEmpty()) {
            return new PipelineRun(context, false, Optional.empty());
        }

        Map<String, LogExcerpt> excerpts = logAggregator.fetchAll(critical);
        WorkflowContext bundle = context.withLogs(excerpts);
        LOGGER.info("Handing off " + critical.size() + " critical service(s): " + String.join(", ", critical));

        String text;
        try {
            text = analysisClient.analyze(bundle);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Analysis handoff failed for " + critical, e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "pipeline",
                    "Analysis handoff failed: " + e.getMessage(),
                    Map.of("services", critical)
            ));
            eventBus.publish(new AnalysisHandedOff(clock.instant(), critical, false, 0));
            return new PipelineRun(bundle, false, Optional.empty());
        }

        Advisory advisory = new Advisory(clock.instant(), critical, text);
        latestAdvisory.set(advisory);
        eventBus.publish(new AnalysisHandedOff(clock.instant(), critical, true, advisory.text().length()));
        return new PipelineRun(bundle, true, Optional.of(advisory));
    }

    public Optional<Advisory> latestAdvisory() {
        return Optional.ofNullable(latestAdvisory.get());
    }
}
