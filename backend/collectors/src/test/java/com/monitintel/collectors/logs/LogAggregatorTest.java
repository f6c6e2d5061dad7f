package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogAggregatorTest {
    @TempDir
    Path dir;

    @Test
    void dispatchesRegisteredServiceToItsStrategy() throws Exception {
        Path log = dir.resolve("nginx.log");
        Files.write(log, List.of("GET / 200", "GET /health 200"));
        LogRegistry registry = new LogRegistry(Map.of("nginx", LogFetchSpec.of(LogStrategy.TAIL_FILE, log.toString(), 10)));

        try (LogAggregator aggregator = new LogAggregator(registry,
                Map.of(LogStrategy.TAIL_FILE, new TailFileLogSource()), LogAggregator.Options.defaults())) {
            LogExcerpt excerpt = aggregator.fetch("nginx");

            assertEquals(LogStrategy.TAIL_FILE, excerpt.strategy());
            assertEquals(List.of("GET / 200", "GET /health 200"), excerpt.lines());
        }
    }

    @Test
    void rejectsRegistryEntriesWithoutASource() {
        LogRegistry registry = new LogRegistry(Map.of("backup", LogFetchSpec.of(LogStrategy.NEWEST_OF_GLOB, "/tmp/*.log", 10)));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () ->
                new LogAggregator(registry, Map.of(LogStrategy.TAIL_FILE, new TailFileLogSource()), LogAggregator.Options.defaults()));
        assertTrue(error.getMessage().contains("newest-of-glob"));
    }

    @Test
    void unregisteredServiceFallsBackToCandidateJournalUnits() {
        List<String> asked = new CopyOnWriteArrayList<>();
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            asked.add(spec.locator());
            if (spec.locator().equals("home-assistant.service")) {
                return LogExcerpt.of(service, LogStrategy.JOURNAL_QUERY, spec.locator(), List.of("started"));
            }
            return LogExcerpt.empty(service, LogStrategy.JOURNAL_QUERY, spec.locator(), "no journal entries for unit " + spec.locator());
        });

        try (LogAggregator aggregator = new LogAggregator(LogRegistry.empty(),
                Map.of(LogStrategy.JOURNAL_QUERY, journal), LogAggregator.Options.defaults())) {
            LogExcerpt excerpt = aggregator.fetch("home_assistant");

            assertEquals(List.of("started"), excerpt.lines());
            assertEquals(List.of("home_assistant.service", "home-assistant.service"), asked);
        }
    }

    @Test
    void fallbackExhaustionCollectsReasons() {
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY,
                (service, spec) -> LogExcerpt.empty(service, LogStrategy.JOURNAL_QUERY, spec.locator(), "nothing for " + spec.locator()));

        try (LogAggregator aggregator = new LogAggregator(LogRegistry.empty(),
                Map.of(LogStrategy.JOURNAL_QUERY, journal), LogAggregator.Options.defaults())) {
            LogExcerpt excerpt = aggregator.fetch("cron");

            assertTrue(excerpt.isEmpty());
            assertTrue(excerpt.reason().contains("nothing for cron.service"));
            assertTrue(excerpt.reason().contains("nothing for cron"));
        }
    }

    @Test
    void disabledFallbackReportsMissingRegistration() {
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            throw new AssertionError("journal must not be queried");
        });

        try (LogAggregator aggregator = new LogAggregator(LogRegistry.empty(), Map.of(LogStrategy.JOURNAL_QUERY, journal),
                new LogAggregator.Options(List.of(), false, Duration.ofSeconds(1)))) {
            assertEquals("no log source registered for cron", aggregator.fetch("cron").reason());
        }
    }

    @Test
    void candidateUnitsDropDuplicates() {
        assertEquals(List.of("sshd.service", "sshd"), LogAggregator.candidateUnits("sshd"));
        assertEquals(List.of("a_b.service", "a-b.service", "a_b"), LogAggregator.candidateUnits("a_b"));
    }

    @Test
    void fileSpecsOutsideLogRootsAreRefused() throws Exception {
        Path allowed = Files.createDirectories(dir.resolve("logs"));
        Path inside = allowed.resolve("app.log");
        Files.write(inside, List.of("ok"));
        Path outside = dir.resolve("secret.txt");
        Files.write(outside, List.of("secret"));
        LogRegistry registry = new LogRegistry(Map.of(
                "app", LogFetchSpec.of(LogStrategy.TAIL_FILE, inside.toString(), 10),
                "secret", LogFetchSpec.of(LogStrategy.TAIL_FILE, outside.toString(), 10),
                "sneaky", LogFetchSpec.of(LogStrategy.TAIL_FILE, allowed + "/../secret.txt", 10),
                "rotated", LogFetchSpec.of(LogStrategy.NEWEST_OF_GLOB, dir + "/*.txt", 10)
        ));

        try (LogAggregator aggregator = LogAggregator.standard(registry, Duration.ofSeconds(1),
                new LogAggregator.Options(List.of(allowed), true, Duration.ofSeconds(5)))) {
            assertEquals(List.of("ok"), aggregator.fetch("app").lines());
            assertTrue(aggregator.fetch("secret").reason().contains("outside the configured log roots"));
            assertTrue(aggregator.fetch("sneaky").reason().contains("outside the configured log roots"));
            assertTrue(aggregator.fetch("rotated").reason().contains("outside the configured log roots"));
        }
    }

    @Test
    void failingSourceBecomesEmptyExcerpt() {
        LogSource broken = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            throw new IllegalStateException("journal socket closed");
        });
        LogRegistry registry = new LogRegistry(Map.of("db", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "postgresql", 10)));

        try (LogAggregator aggregator = new LogAggregator(registry, Map.of(LogStrategy.JOURNAL_QUERY, broken),
                LogAggregator.Options.defaults())) {
            LogExcerpt excerpt = aggregator.fetch("db");

            assertTrue(excerpt.isEmpty());
            assertEquals("log source failed: journal socket closed", excerpt.reason());
        }
    }

    @Test
    void oversizedSourceOutputIsCapped() {
        LogSource chatty = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> LogExcerpt.of(service,
                LogStrategy.JOURNAL_QUERY, spec.locator(),
                IntStream.range(0, 50).mapToObj(Integer::toString).collect(Collectors.toList())));
        LogRegistry registry = new LogRegistry(Map.of("chatty", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "chatty", 5)));

        try (LogAggregator aggregator = new LogAggregator(registry, Map.of(LogStrategy.JOURNAL_QUERY, chatty),
                LogAggregator.Options.defaults())) {
            assertEquals(List.of("45", "46", "47", "48", "49"), aggregator.fetch("chatty").lines());
        }
    }

    @Test
    void fetchAllIsolatesSlowFetchesAndKeepsInputOrder() {
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            if (service.equals("slow")) {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return LogExcerpt.of(service, LogStrategy.JOURNAL_QUERY, spec.locator(), List.of(service + " line"));
        });
        LogRegistry registry = new LogRegistry(Map.of(
                "fast", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "fast", 10),
                "slow", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "slow", 10),
                "other", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "other", 10)
        ));

        try (LogAggregator aggregator = new LogAggregator(registry, Map.of(LogStrategy.JOURNAL_QUERY, journal),
                new LogAggregator.Options(List.of(), true, Duration.ofMillis(300)))) {
            long started = System.nanoTime();
            Map<String, LogExcerpt> excerpts = aggregator.fetchAll(List.of("fast", "slow", "other"));
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

            assertEquals(new ArrayList<>(List.of("fast", "slow", "other")), new ArrayList<>(excerpts.keySet()));
            assertEquals(List.of("fast line"), excerpts.get("fast").lines());
            assertEquals(List.of("other line"), excerpts.get("other").lines());
            assertTrue(excerpts.get("slow").isEmpty());
            assertTrue(excerpts.get("slow").reason().contains("timed out"));
            assertTrue(elapsedMillis < 2_500, "took " + elapsedMillis + "ms");
        }
    }

    @Test
    void fallbackStopsTryingUnitsOnceFetchBudgetIsSpent() {
        List<String> asked = new CopyOnWriteArrayList<>();
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            asked.add(spec.locator());
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return LogExcerpt.empty(service, LogStrategy.JOURNAL_QUERY, spec.locator(), "no journal entries for unit " + spec.locator());
        });

        try (LogAggregator aggregator = new LogAggregator(LogRegistry.empty(), Map.of(LogStrategy.JOURNAL_QUERY, journal),
                new LogAggregator.Options(List.of(), true, Duration.ofMillis(300)))) {
            LogExcerpt excerpt = aggregator.fetch("a_b");

            assertTrue(excerpt.isEmpty());
            assertTrue(asked.size() < 3, "asked " + asked);
            assertTrue(excerpt.reason().contains("fetch budget of 300ms spent"), excerpt.reason());
        }
    }

    @Test
    void fetchAllInterruptsFetchThatOutlivesTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        LogSource journal = new StubSource(LogStrategy.JOURNAL_QUERY, (service, spec) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return LogExcerpt.empty(service, LogStrategy.JOURNAL_QUERY, spec.locator(), "late");
        });
        LogRegistry registry = new LogRegistry(Map.of("stuck", LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, "stuck", 10)));

        try (LogAggregator aggregator = new LogAggregator(registry, Map.of(LogStrategy.JOURNAL_QUERY, journal),
                new LogAggregator.Options(List.of(), true, Duration.ofMillis(200)))) {
            LogExcerpt excerpt = aggregator.fetchAll(List.of("stuck")).get("stuck");

            assertTrue(excerpt.reason().contains("timed out"));
            assertTrue(interrupted.await(2, TimeUnit.SECONDS), "worker was not interrupted");
        }
    }

    private record StubSource(LogStrategy strategy, BiFunction<String, LogFetchSpec, LogExcerpt> behavior) implements LogSource {
        @Override
        public LogExcerpt fetch(String serviceName, LogFetchSpec spec) {
            return behavior.apply(serviceName, spec);
        }
    }
}
