package com.monitintel.service.runtime;

import com.monitintel.collectors.api.Collector;
import com.monitintel.collectors.api.CollectorContext;
import com.monitintel.collectors.api.CollectorResult;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.CycleCompleted;
import com.monitintel.core.events.CycleStarted;
import com.monitintel.service.pipeline.DetectionPipeline;
import com.monitintel.service.pipeline.PipelineRun;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One poll, retention, detect, fetch, handoff sequence. No stage failure escapes; detection runs
 * even when the poll was abandoned since it only acts on snapshots not yet assessed.
 */
public class MonitorCycle {
    private static final Logger LOGGER = Logger.getLogger(MonitorCycle.class.getName());

    private final Collector collector;
    private final CollectorContext context;
    private final RetentionSweeper retentionSweeper;
    private final DetectionPipeline pipeline;
    private final AtomicLong cycleCounter = new AtomicLong();

    public MonitorCycle(
            Collector collector,
            CollectorContext context,
            RetentionSweeper retentionSweeper,
            DetectionPipeline pipeline
    ) {
        this.collector = Objects.requireNonNull(collector, "collector is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.retentionSweeper = Objects.requireNonNull(retentionSweeper, "retentionSweeper is required");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
    }

    public CycleReport run() {
        long cycleNumber = cycleCounter.incrementAndGet();
        Instant startedAt = context.clock().instant();
        context.eventBus().publish(new CycleStarted(startedAt, cycleNumber));

        CollectorResult ingest = ingest();
        int deleted = retentionSweeper.sweep();
        Optional<PipelineRun> run = detect();

        long durationMillis = Duration.between(startedAt, context.clock().instant()).toMillis();
        CycleReport report = new CycleReport(cycleNumber, ingest, deleted, run, durationMillis);
        context.eventBus().publish(new CycleCompleted(
                context.clock().instant(),
                cycleNumber,
                report.success(),
                durationMillis,
                report.criticalServices()
        ));
        LOGGER.info("Cycle " + cycleNumber + " finished in " + durationMillis + "ms: " + ingest.message()
                + ", " + report.criticalServices() + " critical");
        return report;
    }

    private CollectorResult ingest() {
        try {
            return collector.poll(context).join();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Collector " + collector.name() + " failed unexpectedly", e);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "source",
                    "Collector run failed: " + collector.name() + " - " + e.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure("Collector run failed: " + collector.name(), Map.of("persisted", 0));
        }
    }

    private Optional<PipelineRun> detect() {
        try {
            return Optional.of(pipeline.run());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Detection pipeline failed", e);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "pipeline",
                    "Detection pipeline failed: " + e.getMessage(),
                    Map.of()
            ));
            return Optional.empty();
        }
    }
}
