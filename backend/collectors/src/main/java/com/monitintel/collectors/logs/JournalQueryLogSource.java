package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Queries the systemd journal for one unit through {@code journalctl}. The subprocess is
 * destroyed when it outlives the timeout.
 */
public class JournalQueryLogSource implements LogSource {
    static final String NO_ENTRIES_MARKER = "-- No entries --";
    private static final Logger LOGGER = Logger.getLogger(JournalQueryLogSource.class.getName());
    private static final int STDERR_LINES = 5;

    private final List<String> command;
    private final Duration timeout;
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "journal-reader");
        thread.setDaemon(true);
        return thread;
    });

    public JournalQueryLogSource(Duration timeout) {
        this(List.of("journalctl"), timeout);
    }

    /**
     * @param command executable and leading arguments; unit selection and line count are appended
     */
    public JournalQueryLogSource(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "command is required");
        Objects.requireNonNull(timeout, "timeout is required");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public LogStrategy strategy() {
        return LogStrategy.JOURNAL_QUERY;
    }

    @Override
    public LogExcerpt fetch(String serviceName, LogFetchSpec spec) {
        String unit = spec.locator();
        List<String> invocation = new ArrayList<>(command);
        if (spec.userJournal()) {
            invocation.add("--user");
        }
        invocation.addAll(List.of("-u", unit, "-n", String.valueOf(spec.maxLines()), "--no-pager"));

        Process process;
        try {
            process = new ProcessBuilder(invocation).start();
        } catch (IOException e) {
            return LogExcerpt.empty(serviceName, strategy(), unit, "journal query unavailable: " + e.getMessage());
        }
        CompletableFuture<List<String>> stdout = readAsync(process.getInputStream(), spec.maxLines());
        CompletableFuture<List<String>> stderr = readAsync(process.getErrorStream(), STDERR_LINES);

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                LOGGER.warning("journalctl for " + unit + " exceeded " + timeout.toMillis() + "ms; process destroyed");
                return LogExcerpt.empty(serviceName, strategy(), unit,
                        "journal query for " + unit + " timed out after " + timeout.toMillis() + "ms");
            }
            long remaining = Math.max(TimeUnit.MILLISECONDS.toNanos(100), deadline - System.nanoTime());
            List<String> lines = stdout.get(remaining, TimeUnit.NANOSECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                List<String> errors = drained(stderr);
                String detail = errors.isEmpty() ? "" : ": " + String.join(" ", errors);
                return LogExcerpt.empty(serviceName, strategy(), unit,
                        "journalctl exited with " + exitCode + " for " + unit + detail);
            }
            List<String> entries = lines.stream()
                    .filter(line -> !NO_ENTRIES_MARKER.equals(line.trim()))
                    .toList();
            if (entries.isEmpty()) {
                return LogExcerpt.empty(serviceName, strategy(), unit, "no journal entries for unit " + unit);
            }
            return LogExcerpt.of(serviceName, strategy(), unit, TailReader.cap(entries, spec.maxLines()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return LogExcerpt.empty(serviceName, strategy(), unit, "journal query for " + unit + " interrupted");
        } catch (TimeoutException e) {
            process.destroyForcibly();
            return LogExcerpt.empty(serviceName, strategy(), unit,
                    "journal output for " + unit + " not drained within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            return LogExcerpt.empty(serviceName, strategy(), unit,
                    "error reading journal output for " + unit + ": " + e.getCause().getMessage());
        }
    }

    private static List<String> drained(CompletableFuture<List<String>> stderr) {
        try {
            return stderr.get(200, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | TimeoutException e) {
            return List.of("(stderr unavailable)");
        }
    }

    private CompletableFuture<List<String>> readAsync(InputStream stream, int maxLines) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return TailReader.lastLines(stream, maxLines);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }
}
