package com.monitintel.service.runtime;

import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.RetentionSwept;
import com.monitintel.core.model.Snapshot;
import com.monitintel.service.store.Database;
import com.monitintel.service.store.JdbcSnapshotStore;
import com.monitintel.service.store.JsonlEventStore;
import com.monitintel.service.support.EventCapture;
import com.monitintel.service.support.MutableClock;
import com.monitintel.service.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetentionSweeperTest {
    private static final Instant NOW = Instant.parse("2026-03-31T12:00:00Z");

    private Database database;
    private MutableClock clock;
    private JdbcSnapshotStore snapshots;
    private EventBus bus;
    private EventCapture capture;

    @BeforeEach
    void setUp() {
        database = TestDatabases.inMemory();
        clock = new MutableClock(NOW);
        snapshots = new JdbcSnapshotStore(database, clock);
        bus = new EventBus();
        capture = new EventCapture(bus);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void cutoffIsNowMinusRetentionDays() {
        RetentionSweeper sweeper = new RetentionSweeper(snapshots, null, bus, clock, 30);
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), sweeper.cutoff());
    }

    @Test
    void sweepDeletesStrictlyOlderSnapshots() {
        RetentionSweeper sweeper = new RetentionSweeper(snapshots, null, bus, clock, 30);
        Instant cutoff = sweeper.cutoff();
        snapshots.append(new Snapshot("nginx", cutoff.minusSeconds(1), 0, "{}"));
        snapshots.append(new Snapshot("nginx", cutoff, 0, "{}"));
        snapshots.append(new Snapshot("nginx", NOW, 0, "{}"));

        assertEquals(1, sweeper.sweep());
        assertEquals(2, snapshots.count());

        RetentionSwept swept = capture.byType(RetentionSwept.class).get(0);
        assertEquals(cutoff, swept.cutoff());
        assertEquals(1, swept.deleted());
    }

    @Test
    void windowMovesWithTheClock() {
        RetentionSweeper sweeper = new RetentionSweeper(snapshots, null, bus, clock, 1);
        snapshots.append(new Snapshot("nginx", NOW, 0, "{}"));
        assertEquals(0, sweeper.sweep());

        clock.advance(Duration.ofDays(1).plusSeconds(1));
        assertEquals(1, sweeper.sweep());
    }

    @Test
    void sweepAlsoCompactsTheEventJournal() throws Exception {
        JsonlEventStore journal = new JsonlEventStore(Files.createTempDirectory("retention-journal-").resolve("events.jsonl"));
        journal.append(new AlertRaised(NOW.minus(Duration.ofDays(40)), "source", "old", Map.of()));
        journal.append(new AlertRaised(NOW.minusSeconds(5), "source", "recent", Map.of()));
        RetentionSweeper sweeper = new RetentionSweeper(snapshots, journal, bus, clock, 30);

        sweeper.sweep();

        assertEquals(1, journal.query(Instant.EPOCH, Optional.empty(), 10).size());
    }

    @Test
    void failedDeleteIsAlertedAndReturnsZero() {
        JdbcSnapshotStore failing = new JdbcSnapshotStore(database, clock) {
            @Override
            public int deleteOlderThan(Instant cutoff) {
                throw new IllegalStateException("Failed deleting snapshots older than " + cutoff);
            }
        };
        RetentionSweeper sweeper = new RetentionSweeper(failing, null, bus, clock, 30);

        assertEquals(0, sweeper.sweep());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("store", alert.category());
        assertTrue(capture.byType(RetentionSwept.class).isEmpty());
    }

    @Test
    void retentionDaysMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionSweeper(snapshots, null, bus, clock, 0));
    }
}
