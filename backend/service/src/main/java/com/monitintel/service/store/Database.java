package com.monitintel.service.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Embedded H2 database holding snapshots and failure state. One connection stays open for the
 * lifetime of this object so the database is not closed and reopened between statements.
 */
public final class Database implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(Database.class.getName());

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS snapshots (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                service_name VARCHAR(255) NOT NULL,
                observed_at TIMESTAMP WITH TIME ZONE NOT NULL,
                status INTEGER NOT NULL,
                payload CLOB NOT NULL,
                created_at TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_snapshots_service_time ON snapshots (service_name, observed_at)",
            "CREATE INDEX IF NOT EXISTS idx_snapshots_observed_at ON snapshots (observed_at)",
            """
            CREATE TABLE IF NOT EXISTS failure_state (
                service_name VARCHAR(255) PRIMARY KEY,
                last_status INTEGER NOT NULL,
                last_checked TIMESTAMP WITH TIME ZONE,
                times_failed INTEGER NOT NULL DEFAULT 0,
                first_failure_time TIMESTAMP WITH TIME ZONE,
                last_failure_time TIMESTAMP WITH TIME ZONE
            )
            """
    );

    private final String url;
    private final Connection keepAlive;

    private Database(String url, Connection keepAlive) {
        this.url = url;
        this.keepAlive = keepAlive;
    }

    public static Database open(String url) {
        Objects.requireNonNull(url, "url is required");
        Connection connection;
        try {
            connection = DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed opening database " + url, e);
        }
        Database database = new Database(url, connection);
        database.migrate();
        LOGGER.info("Database ready at " + url);
        return database;
    }

    public Connection connection() throws SQLException {
        return DriverManager.getConnection(url);
    }

    private void migrate() {
        try (Statement statement = keepAlive.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed creating schema in " + url, e);
        }
    }

    @Override
    public void close() {
        try {
            keepAlive.close();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed closing database " + url, e);
        }
    }
}
