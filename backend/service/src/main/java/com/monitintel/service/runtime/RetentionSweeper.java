package com.monitintel.service.runtime;

import com.monitintel.collectors.api.SnapshotStore;
import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.RetentionSwept;
import com.monitintel.service.store.EventStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes snapshots (and journal events) older than the retention window. Best effort: a failure
 * is logged and alerted, and the next tick tries again.
 */
public class RetentionSweeper {
    private static final Logger LOGGER = Logger.getLogger(RetentionSweeper.class.getName());

    private final SnapshotStore snapshots;
    private final EventStore events;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration window;

    public RetentionSweeper(SnapshotStore snapshots, EventStore events, EventBus eventBus, Clock clock, int retentionDays) {
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive: " + retentionDays);
        }
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
        this.events = events;
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.window = Duration.ofDays(retentionDays);
    }

    public Instant cutoff() {
        return clock.instant().minus(window);
    }

    /**
     * @return number of deleted snapshots, 0 when the sweep failed
     */
    public int sweep() {
        Instant cutoff = cutoff();
        int deleted;
        try {
            deleted = snapshots.deleteOlderThan(cutoff);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Retention sweep failed for cutoff " + cutoff, e);
            eventBus.publish(new AlertRaised(clock.instant(), "store",
                    "Retention sweep failed: " + e.getMessage(), Map.of("cutoff", cutoff.toString())));
            return 0;
        }
        if (deleted > 0) {
            LOGGER.info("Retention sweep removed " + deleted + " snapshots older than " + cutoff);
        }
        eventBus.publish(new RetentionSwept(clock.instant(), cutoff, deleted));
        compactJournal(cutoff);
        return deleted;
    }

    private void compactJournal(Instant cutoff) {
        if (events == null) {
            return;
        }
        try {
            events.compact(cutoff);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Event journal compaction failed for cutoff " + cutoff, e);
        }
    }
}
