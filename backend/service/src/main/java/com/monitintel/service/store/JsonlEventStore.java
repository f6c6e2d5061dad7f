package com.monitintel.service.store;

import com.monitintel.core.events.Event;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only JSONL journal of cycle events. {@link #compact(Instant)} rewrites the file through a
 * temporary sibling.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    @Override
    public void append(Event event) {
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(EventCodec.toJsonLine(event));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<Event> events = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event = decode(line, lineNumber).orElse(null);
                if (event == null || event.timestamp().isBefore(since)) {
                    continue;
                }
                if (type.isPresent() && !type.get().equals(event.type())) {
                    continue;
                }
                events.add(event);
            }
            if (events.size() <= limit) {
                return events;
            }
            return events.subList(events.size() - limit, events.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int compact(Instant cutoff) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return 0;
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            List<String> kept = new ArrayList<>();
            int lineNumber = 0;
            for (String line : lines) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Optional<Event> event = decode(line, lineNumber);
                if (event.isPresent() && !event.get().timestamp().isBefore(cutoff)) {
                    kept.add(line);
                }
            }
            int dropped = lines.size() - kept.size();
            if (dropped > 0) {
                Path temp = file.resolveSibling(file.getFileName() + ".tmp");
                Files.write(temp, kept, StandardCharsets.UTF_8);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                LOGGER.info("Compacted event journal " + file + ": dropped " + dropped + " lines");
            }
            return dropped;
        } catch (IOException e) {
            throw new IllegalStateException("Failed compacting events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    // Torn or foreign lines are skipped so one bad write cannot block reads or compaction.
    private Optional<Event> decode(String line, int lineNumber) {
        try {
            return Optional.of(EventCodec.fromJsonLine(line));
        } catch (RuntimeException decodeError) {
            LOGGER.log(Level.WARNING, "Skipping undecodable event at " + file + " line " + lineNumber, decodeError);
            return Optional.empty();
        }
    }
}
