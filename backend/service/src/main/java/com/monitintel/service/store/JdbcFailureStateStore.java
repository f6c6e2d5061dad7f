package com.monitintel.service.store;

import com.monitintel.core.model.FailureState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JdbcFailureStateStore implements FailureStateStore {
    private static final String COLUMNS =
            "service_name, last_status, last_checked, times_failed, first_failure_time, last_failure_time";

    private final Database database;

    public JdbcFailureStateStore(Database database) {
        this.database = Objects.requireNonNull(database, "database is required");
    }

    @Override
    public Optional<FailureState> find(String serviceName) {
        String sql = "SELECT " + COLUMNS + " FROM failure_state WHERE service_name = ?";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, serviceName);
            List<FailureState> rows = read(statement);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new IllegalStateException("Failed reading failure state for " + serviceName, e);
        }
    }

    @Override
    public void upsert(FailureState state) {
        String sql = "MERGE INTO failure_state (" + COLUMNS + ") KEY (service_name) VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, state.serviceName());
            statement.setInt(2, state.lastStatus());
            SqlTimes.set(statement, 3, state.lastChecked());
            statement.setInt(4, state.timesFailed());
            SqlTimes.set(statement, 5, state.firstFailureTime());
            SqlTimes.set(statement, 6, state.lastFailureTime());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed storing failure state for " + state.serviceName(), e);
        }
    }

    @Override
    public List<FailureState> all() {
        String sql = "SELECT " + COLUMNS + " FROM failure_state ORDER BY service_name";
        try (Connection connection = database.connection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            return read(statement);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed reading failure states", e);
        }
    }

    private static List<FailureState> read(PreparedStatement statement) throws SQLException {
        List<FailureState> states = new ArrayList<>();
        try (ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                states.add(new FailureState(
                        rows.getString("service_name"),
                        rows.getInt("last_status"),
                        SqlTimes.get(rows, "last_checked"),
                        rows.getInt("times_failed"),
                        SqlTimes.get(rows, "first_failure_time"),
                        SqlTimes.get(rows, "last_failure_time")
                ));
            }
        }
        return states;
    }
}
