package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches log fetches to the source registered for each strategy. A fetch never throws: every
 * failure comes back as an empty excerpt with a reason.
 */
public class LogAggregator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(LogAggregator.class.getName());

    private final LogRegistry registry;
    private final Map<LogStrategy, LogSource> sources;
    private final Options options;
    private final ExecutorService fetchPool;

    public LogAggregator(LogRegistry registry, Map<LogStrategy, LogSource> sources, Options options) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.options = Objects.requireNonNull(options, "options are required");
        Objects.requireNonNull(sources, "sources are required");
        this.sources = sources.isEmpty() ? new EnumMap<>(LogStrategy.class) : new EnumMap<>(sources);
        for (Map.Entry<String, LogFetchSpec> entry : registry.asMap().entrySet()) {
            if (!this.sources.containsKey(entry.getValue().strategy())) {
                throw new IllegalArgumentException("No log source for strategy "
                        + entry.getValue().strategy().configName() + " required by service " + entry.getKey());
            }
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.fetchPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "log-fetch-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Aggregator wired with the three built-in sources.
     */
    public static LogAggregator standard(LogRegistry registry, Duration journalTimeout, Options options) {
        Map<LogStrategy, LogSource> sources = new EnumMap<>(LogStrategy.class);
        sources.put(LogStrategy.TAIL_FILE, new TailFileLogSource());
        sources.put(LogStrategy.NEWEST_OF_GLOB, new NewestOfGlobLogSource());
        sources.put(LogStrategy.JOURNAL_QUERY, new JournalQueryLogSource(journalTimeout));
        return new LogAggregator(registry, sources, options);
    }

    public LogExcerpt fetch(String serviceName) {
        Optional<LogFetchSpec> registered = registry.lookup(serviceName);
        if (registered.isPresent()) {
            return fetchWith(serviceName, registered.get());
        }
        if (!options.journalFallback() || !sources.containsKey(LogStrategy.JOURNAL_QUERY)) {
            return LogExcerpt.empty(serviceName, null, null, "no log source registered for " + serviceName);
        }
        return journalFallback(serviceName);
    }

    /**
     * Fetches every service concurrently. A fetch that outlives the timeout yields an empty excerpt
     * without holding back the others, and its worker is interrupted. Result order follows the input
     * order.
     */
    public Map<String, LogExcerpt> fetchAll(Collection<String> serviceNames) {
        long deadline = System.nanoTime() + options.fetchTimeout().toNanos();
        Map<String, Future<LogExcerpt>> pending = new LinkedHashMap<>();
        for (String serviceName : new LinkedHashSet<>(serviceNames)) {
            pending.put(serviceName, fetchPool.submit(() -> fetch(serviceName)));
        }
        Map<String, LogExcerpt> excerpts = new LinkedHashMap<>();
        pending.forEach((serviceName, future) -> excerpts.put(serviceName, await(serviceName, future, deadline)));
        return excerpts;
    }

    private LogExcerpt await(String serviceName, Future<LogExcerpt> future, long deadline) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return timedOut(serviceName);
        } catch (ExecutionException e) {
            return failed(serviceName, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(serviceName, e);
        }
    }

    private LogExcerpt fetchWith(String serviceName, LogFetchSpec spec) {
        Optional<String> outsideRoots = outsideRoots(spec);
        if (outsideRoots.isPresent()) {
            LOGGER.warning("Refusing log fetch for " + serviceName + ": " + outsideRoots.get());
            return LogExcerpt.empty(serviceName, spec.strategy(), spec.locator(), outsideRoots.get());
        }
        LogSource source = sources.get(spec.strategy());
        try {
            LogExcerpt excerpt = source.fetch(serviceName, spec);
            if (excerpt.lines().size() > spec.maxLines()) {
                return new LogExcerpt(excerpt.serviceName(), excerpt.strategy(), excerpt.source(),
                        TailReader.cap(excerpt.lines(), spec.maxLines()), excerpt.reason());
            }
            return excerpt;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Log source " + spec.strategy().configName() + " failed for " + serviceName, e);
            return LogExcerpt.empty(serviceName, spec.strategy(), spec.locator(),
                    "log source failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
    }

    private LogExcerpt journalFallback(String serviceName) {
        long deadline = System.nanoTime() + options.fetchTimeout().toNanos();
        List<String> reasons = new ArrayList<>();
        for (String unit : candidateUnits(serviceName)) {
            if (Thread.currentThread().isInterrupted()) {
                reasons.add("fallback interrupted before " + unit);
                break;
            }
            if (System.nanoTime() - deadline >= 0) {
                reasons.add("fetch budget of " + options.fetchTimeout().toMillis() + "ms spent before " + unit);
                break;
            }
            LogExcerpt excerpt = fetchWith(serviceName,
                    LogFetchSpec.of(LogStrategy.JOURNAL_QUERY, unit, LogFetchSpec.DEFAULT_MAX_LINES));
            if (!excerpt.isEmpty()) {
                return excerpt;
            }
            reasons.add(excerpt.reason());
        }
        return LogExcerpt.empty(serviceName, LogStrategy.JOURNAL_QUERY, null,
                "no registered log source and no journal entries for " + serviceName + " (" + String.join("; ", reasons) + ")");
    }

    static List<String> candidateUnits(String serviceName) {
        LinkedHashSet<String> units = new LinkedHashSet<>();
        units.add(serviceName + ".service");
        units.add(serviceName.replace('_', '-') + ".service");
        units.add(serviceName);
        return List.copyOf(units);
    }

    private Optional<String> outsideRoots(LogFetchSpec spec) {
        if (options.logRoots().isEmpty() || spec.strategy() == LogStrategy.JOURNAL_QUERY) {
            return Optional.empty();
        }
        Path target;
        try {
            target = spec.strategy() == LogStrategy.NEWEST_OF_GLOB
                    ? NewestOfGlobLogSource.baseDirectory(spec.locator())
                    : Path.of(spec.locator());
        } catch (IllegalArgumentException e) {
            return Optional.of("invalid log locator " + spec.locator());
        }
        Path normalized = target.toAbsolutePath().normalize();
        for (Path root : options.logRoots()) {
            if (normalized.startsWith(root.toAbsolutePath().normalize())) {
                return Optional.empty();
            }
        }
        return Optional.of("log path " + spec.locator() + " is outside the configured log roots");
    }

    private LogExcerpt timedOut(String serviceName) {
        LOGGER.warning("Log fetch for " + serviceName + " exceeded " + options.fetchTimeout().toMillis() + "ms");
        LogStrategy strategy = registry.lookup(serviceName).map(LogFetchSpec::strategy).orElse(null);
        return LogExcerpt.empty(serviceName, strategy, null,
                "log fetch timed out after " + options.fetchTimeout().toMillis() + "ms");
    }

    private LogExcerpt failed(String serviceName, Throwable error) {
        LOGGER.log(Level.WARNING, "Log fetch failed for " + serviceName, error);
        return LogExcerpt.empty(serviceName, null, null, "log fetch failed: " + error.getMessage());
    }

    @Override
    public void close() {
        fetchPool.shutdownNow();
    }

    /**
     * @param logRoots directories file-backed locators must resolve under; empty allows any path
     * @param journalFallback whether unregistered services are looked up in the journal
     * @param fetchTimeout budget for each fetch inside {@link #fetchAll(Collection)}, and for the whole
     *     journal fallback of one service
     */
    public record Options(List<Path> logRoots, boolean journalFallback, Duration fetchTimeout) {
        public Options {
            logRoots = logRoots == null ? List.of() : List.copyOf(logRoots);
            Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
            if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
                throw new IllegalArgumentException("fetchTimeout must be positive");
            }
        }

        public static Options defaults() {
            return new Options(List.of(), true, Duration.ofSeconds(15));
        }
    }
}
