package com.monitintel.service.store;

import com.monitintel.collectors.api.SnapshotStore;
import com.monitintel.core.model.Snapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@link SnapshotStore} over the {@code snapshots} table. Every operation is a single statement.
 */
public class JdbcSnapshotStore implements SnapshotStore {
    private static final String COLUMNS = "service_name, observed_at, status, payload";

    private final Database database;
    private final Clock clock;

    public JdbcSnapshotStore(Database database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public void append(Snapshot snapshot) {
        String sql = "INSERT INTO snapshots (" + COLUMNS + ", created_at) VALUES (?, ?, ?, ?, ?)";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, snapshot.serviceName());
            SqlTimes.set(statement, 2, snapshot.observedAt());
            statement.setInt(3, snapshot.status());
            statement.setString(4, snapshot.payload());
            SqlTimes.set(statement, 5, clock.instant());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed appending snapshot for " + snapshot.serviceName(), e);
        }
    }

    @Override
    public List<Snapshot> recentStatus(String serviceName, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM snapshots WHERE service_name = ? "
                + "ORDER BY observed_at DESC, id DESC LIMIT ?";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, serviceName);
            statement.setInt(2, limit);
            List<Snapshot> newestFirst = read(statement);
            Collections.reverse(newestFirst);
            return newestFirst;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed reading recent snapshots for " + serviceName, e);
        }
    }

    @Override
    public List<Snapshot> query(String serviceName, Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + " FROM snapshots WHERE service_name = ? "
                + "AND observed_at >= ? AND observed_at < ? ORDER BY observed_at, id";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, serviceName);
            SqlTimes.set(statement, 2, from);
            SqlTimes.set(statement, 3, to);
            return read(statement);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed querying snapshots for " + serviceName, e);
        }
    }

    @Override
    public List<Snapshot> latestPerService() {
        String sql = "SELECT " + COLUMNS + " FROM ("
                + "SELECT " + COLUMNS + ", ROW_NUMBER() OVER "
                + "(PARTITION BY service_name ORDER BY observed_at DESC, id DESC) AS rn FROM snapshots"
                + ") ranked WHERE rn = 1 ORDER BY service_name";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            return read(statement);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed reading latest snapshots", e);
        }
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM snapshots WHERE observed_at < ?")) {
            SqlTimes.set(statement, 1, cutoff);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed deleting snapshots older than " + cutoff, e);
        }
    }

    @Override
    public long count() {
        try (Connection connection = database.connection();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM snapshots")) {
            rows.next();
            return rows.getLong(1);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed counting snapshots", e);
        }
    }

    private static List<Snapshot> read(PreparedStatement statement) throws SQLException {
        List<Snapshot> snapshots = new ArrayList<>();
        try (ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                snapshots.add(new Snapshot(
                        rows.getString("service_name"),
                        SqlTimes.get(rows, "observed_at"),
                        rows.getInt("status"),
                        rows.getString("payload")
                ));
            }
        }
        return snapshots;
    }
}
