package com.monitintel.service.pipeline;

import com.monitintel.collectors.logs.LogAggregator;
import com.monitintel.collectors.logs.LogRegistry;
import com.monitintel.collectors.logs.LogSource;
import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.AnalysisHandedOff;
import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;
import com.monitintel.core.model.ServiceAssessment;
import com.monitintel.core.model.Snapshot;
import com.monitintel.core.model.WorkflowContext;
import com.monitintel.service.store.Database;
import com.monitintel.service.store.JdbcSnapshotStore;
import com.monitintel.service.support.EventCapture;
import com.monitintel.service.support.InMemoryFailureStateStore;
import com.monitintel.service.support.MutableClock;
import com.monitintel.service.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetectionPipelineTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private Database database;
    private MutableClock clock;
    private JdbcSnapshotStore snapshots;
    private InMemoryFailureStateStore states;
    private EventBus bus;
    private EventCapture capture;
    private RecordingSource logSource;
    private LogAggregator logAggregator;

    @BeforeEach
    void setUp() {
        database = TestDatabases.inMemory();
        clock = new MutableClock(T0);
        snapshots = new JdbcSnapshotStore(database, clock);
        states = new InMemoryFailureStateStore();
        bus = new EventBus();
        capture = new EventCapture(bus);
        logSource = new RecordingSource();
        LogRegistry registry = new LogRegistry(Map.of(
                "backup_logs", LogFetchSpec.of(LogStrategy.TAIL_FILE, "/var/log/backup.log", 50),
                "nginx", LogFetchSpec.of(LogStrategy.TAIL_FILE, "/var/log/nginx/error.log", 50)
        ));
        logAggregator = new LogAggregator(registry, Map.of(LogStrategy.TAIL_FILE, logSource),
                new LogAggregator.Options(List.of(), false, Duration.ofSeconds(2)));
    }

    @AfterEach
    void tearDown() {
        logAggregator.close();
        database.close();
    }

    @Test
    void healthyCycleSkipsLogsAndHandoff() {
        RecordingAnalysis analysis = RecordingAnalysis.answering("unused");
        DetectionPipeline pipeline = pipeline(analysis);
        snapshots.append(new Snapshot("nginx", T0, 0, "{}"));

        PipelineRun run = pipeline.run();

        assertFalse(run.handedOff());
        assertEquals(0, run.criticalCount());
        assertTrue(run.advisory().isEmpty());
        assertTrue(analysis.received.isEmpty());
        assertTrue(logSource.fetched.isEmpty());
        assertTrue(capture.byType(AnalysisHandedOff.class).isEmpty());
    }

    @Test
    void criticalServicesGetLogsAndOneHandoff() {
        RecordingAnalysis analysis = RecordingAnalysis.answering("check the backup target mount");
        DetectionPipeline pipeline = pipeline(analysis);
        snapshots.append(new Snapshot("backup_logs", T0, 512, "{}"));
        snapshots.append(new Snapshot("nginx", T0, 0, "{}"));

        PipelineRun run = pipeline.run();

        assertTrue(run.handedOff());
        assertEquals(List.of("backup_logs"), logSource.fetched);
        assertEquals(1, analysis.received.size());
        WorkflowContext bundle = analysis.received.get(0);
        assertEquals(List.of("backup_logs"), bundle.criticalServices());
        ServiceAssessment critical = bundle.services().get("backup_logs");
        assertEquals(List.of("line for backup_logs"), critical.logExcerpt().orElseThrow().lines());
        assertTrue(bundle.services().get("nginx").logExcerpt().isEmpty());

        assertEquals("check the backup target mount", pipeline.latestAdvisory().orElseThrow().text());
        AnalysisHandedOff handedOff = capture.byType(AnalysisHandedOff.class).get(0);
        assertTrue(handedOff.success());
        assertEquals(List.of("backup_logs"), handedOff.criticalServices());
    }

    @Test
    void ongoingFailureIsNotHandedOffAgain() {
        RecordingAnalysis analysis = RecordingAnalysis.answering("advice");
        DetectionPipeline pipeline = pipeline(analysis);
        snapshots.append(new Snapshot("backup_logs", T0, 512, "{}"));
        pipeline.run();

        snapshots.append(new Snapshot("backup_logs", T0.plusSeconds(300), 512, "{}"));
        PipelineRun second = pipeline.run();

        assertFalse(second.handedOff());
        assertEquals(1, analysis.received.size());
    }

    @Test
    void failedHandoffIsReportedAndNotRetried() {
        RecordingAnalysis analysis = RecordingAnalysis.failing("analysis endpoint down");
        DetectionPipeline pipeline = pipeline(analysis);
        snapshots.append(new Snapshot("backup_logs", T0, 512, "{}"));

        PipelineRun run = pipeline.run();

        assertFalse(run.handedOff());
        assertEquals(1, analysis.received.size());
        assertTrue(pipeline.latestAdvisory().isEmpty());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("pipeline", alert.category());
        assertTrue(alert.message().contains("analysis endpoint down"));
        assertFalse(capture.byType(AnalysisHandedOff.class).get(0).success());
        assertEquals(1, states.find("backup_logs").orElseThrow().timesFailed());

        pipeline.run();
        assertEquals(1, analysis.received.size());
    }

    private DetectionPipeline pipeline(AnalysisClient analysis) {
        FailureStateTracker tracker = new FailureStateTracker(snapshots, states, bus, clock);
        return new DetectionPipeline(tracker, logAggregator, analysis, bus, clock);
    }

    private static final class RecordingSource implements LogSource {
        private final List<String> fetched = new CopyOnWriteArrayList<>();

        @Override
        public LogStrategy strategy() {
            return LogStrategy.TAIL_FILE;
        }

        @Override
        public LogExcerpt fetch(String serviceName, LogFetchSpec spec) {
            fetched.add(serviceName);
            return LogExcerpt.of(serviceName, LogStrategy.TAIL_FILE, spec.locator(), List.of("line for " + serviceName));
        }
    }

    private static final class RecordingAnalysis implements AnalysisClient {
        private final List<WorkflowContext> received = new ArrayList<>();
        private final String answer;
        private final String failure;

        private RecordingAnalysis(String answer, String failure) {
            this.answer = answer;
            this.failure = failure;
        }

        static RecordingAnalysis answering(String answer) {
            return new RecordingAnalysis(answer, null);
        }

        static RecordingAnalysis failing(String failure) {
            return new RecordingAnalysis(null, failure);
        }

        @Override
        public String analyze(WorkflowContext context) {
            received.add(context);
            if (failure != null) {
                throw new IllegalStateException(failure);
            }
            return answer;
        }
    }
}
