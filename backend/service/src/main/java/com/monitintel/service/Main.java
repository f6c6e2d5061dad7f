package com.monitintel.service;

import com.monitintel.collectors.api.CollectorContext;
import com.monitintel.collectors.logs.LogAggregator;
import com.monitintel.collectors.logs.LogRegistry;
import com.monitintel.collectors.monit.MonitStatusCollector;
import com.monitintel.core.bus.EventBus;
import com.monitintel.service.api.ApiServer;
import com.monitintel.service.api.DiagnosticsTracker;
import com.monitintel.service.config.ConfigLoader;
import com.monitintel.service.config.MonitorConfig;
import com.monitintel.service.http.HttpClientFactory;
import com.monitintel.service.pipeline.AnalysisClient;
import com.monitintel.service.pipeline.DetectionPipeline;
import com.monitintel.service.pipeline.FailureStateTracker;
import com.monitintel.service.pipeline.HttpAnalysisClient;
import com.monitintel.service.pipeline.LoggingAnalysisClient;
import com.monitintel.service.runtime.CycleReport;
import com.monitintel.service.runtime.MonitorCycle;
import com.monitintel.service.runtime.RetentionSweeper;
import com.monitintel.service.runtime.SchedulerService;
import com.monitintel.service.store.Database;
import com.monitintel.service.store.EventCodec;
import com.monitintel.service.store.JdbcFailureStateStore;
import com.monitintel.service.store.JdbcSnapshotStore;
import com.monitintel.service.store.JsonlEventStore;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        RuntimeFlags flags = RuntimeFlags.parse(args);
        Path configDir = flags.configDir();
        Path eventLogFile = Path.of("logs/events.jsonl");
        Clock clock = Clock.systemUTC();

        MonitorConfig config = ConfigLoader.loadMonitor(configDir).withEnvironment(System.getenv());
        LogRegistry registry = ConfigLoader.loadLogRegistry(configDir);
        LOGGER.info("Loaded " + config + " with " + registry.size() + " registered log sources");

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock);

        Database database = Database.open(config.databaseUrl());
        JdbcSnapshotStore snapshotStore = new JdbcSnapshotStore(database, clock);
        JdbcFailureStateStore failureStateStore = new JdbcFailureStateStore(database);

        HttpClient httpClient = HttpClientFactory.create(config);
        CollectorContext context = new CollectorContext(
                httpClient,
                eventBus,
                snapshotStore,
                clock,
                config.requestTimeout(),
                Map.of(MonitStatusCollector.CONFIG_KEY, config.monitSource())
        );

        LogAggregator logAggregator = LogAggregator.standard(
                registry,
                config.journalTimeout(),
                new LogAggregator.Options(config.logRootPaths(), config.journalFallback(), config.fetchTimeout())
        );
        DetectionPipeline pipeline = new DetectionPipeline(
                new FailureStateTracker(snapshotStore, failureStateStore, eventBus, clock),
                logAggregator,
                analysisClient(config, httpClient),
                eventBus,
                clock
        );
        RetentionSweeper sweeper = new RetentionSweeper(snapshotStore, eventStore, eventBus, clock, config.retentionDays());
        MonitorCycle cycle = new MonitorCycle(new MonitStatusCollector(), context, sweeper, pipeline);

        if (flags.once()) {
            CycleReport report = cycle.run();
            logAggregator.close();
            database.close();
            if (!report.success()) {
                System.exit(1);
            }
            return;
        }

        SchedulerService scheduler = new SchedulerService(cycle::run, config.pollInterval(), eventBus, clock);
        ApiServer apiServer = config.apiEnabled()
                ? new ApiServer(config.apiPort(), snapshotStore, failureStateStore, eventStore, logAggregator,
                diagnosticsTracker, pipeline::latestAdvisory, clock)
                : null;

        scheduler.start();
        if (apiServer != null) {
            apiServer.start();
        } else {
            LOGGER.info("apiPort=0; read API disabled");
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            if (apiServer != null) {
                apiServer.stop();
            }
            logAggregator.close();
            database.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static AnalysisClient analysisClient(MonitorConfig config, HttpClient httpClient) {
        if (config.analysisUrl() == null) {
            LOGGER.info("No analysisUrl configured; critical bundles are logged only");
            return new LoggingAnalysisClient();
        }
        return new HttpAnalysisClient(httpClient, URI.create(config.analysisUrl()), Duration.ofMinutes(2));
    }

    record RuntimeFlags(boolean once, Path configDir) {
        static RuntimeFlags parse(String[] args) {
            List<String> arguments = Arrays.asList(args);
            boolean once = false;
            Path configDir = Path.of("config");
            for (int i = 0; i < arguments.size(); i++) {
                String argument = arguments.get(i);
                if ("--once".equals(argument)) {
                    once = true;
                } else if ("--config".equals(argument) && i + 1 < arguments.size()) {
                    configDir = Path.of(arguments.get(++i));
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + argument
                            + " (usage: [--once] [--config <dir>])");
                }
            }
            return new RuntimeFlags(once, configDir);
        }
    }
}
