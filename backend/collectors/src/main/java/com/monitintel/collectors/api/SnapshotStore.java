package com.monitintel.collectors.api;

import com.monitintel.core.model.Snapshot;

import java.time.Instant;
import java.util.List;

/**
 * Append-only time series of health snapshots. Queries return snapshots in ascending
 * {@code observedAt} order.
 */
public interface SnapshotStore {
    void append(Snapshot snapshot);

    /**
     * Last {@code limit} snapshots of one service, oldest first.
     */
    List<Snapshot> recentStatus(String serviceName, int limit);

    /**
     * Snapshots of one service with {@code from <= observedAt < to}.
     */
    List<Snapshot> query(String serviceName, Instant from, Instant to);

    /**
     * Newest snapshot of every service, ordered by service name.
     */
    List<Snapshot> latestPerService();

    /**
     * Removes snapshots strictly older than {@code cutoff}.
     *
     * @return number of deleted snapshots
     */
    int deleteOlderThan(Instant cutoff);

    long count();
}
