package com.p14n.upsbridge.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Collectors;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the device and metrics tables if they do not exist.
 *
 * <pre>
 * {@code
 * new DatabaseSetup(dataSource).setupAll();
 * }
 * </pre>
 */
public class DatabaseSetup {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final DataSource ds;

    public DatabaseSetup(DataSource ds) {
        this.ds = ds;
    }

    public DatabaseSetup setupAll() {
        createDevicesTableIfNotExists();
        createMetricsTableIfNotExists();
        return this;
    }

    /**
     * @throws RuntimeException if table creation fails
     */
    public DatabaseSetup createDevicesTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS ups_devices (
                        device_id SERIAL PRIMARY KEY,
                        device_identifier VARCHAR(255) NOT NULL UNIQUE,
                        display_name VARCHAR(255),
                        created_at TIMESTAMP WITH TIME ZONE DEFAULT current_timestamp
                    )""");
            logger.atInfo().log("Devices table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating devices table");
            throw new RuntimeException("Failed to create ups_devices table", e);
        }
        return this;
    }

    /**
     * @throws RuntimeException if table creation fails
     */
    public DatabaseSetup createMetricsTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute(metricsTableDdl());
            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_ups_metrics_device_time
                    ON ups_metrics (device_id, timestamp DESC)""");
            logger.atInfo().log("Metrics table and index creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating metrics table");
            throw new RuntimeException("Failed to create ups_metrics table", e);
        }
        return this;
    }

    static String metricsTableDdl() {
        String columns = SQL.METRIC_FIELDS.stream()
                .map(f -> "    " + f.topicName() + " " + SQL.columnType(f.type()))
                .collect(Collectors.joining(",\n"));
        return "CREATE TABLE IF NOT EXISTS ups_metrics (\n"
                + "    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,\n"
                + "    device_id INTEGER NOT NULL REFERENCES ups_devices (device_id),\n"
                + "    timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n"
                + columns + ",\n"
                + "    UNIQUE (device_id, timestamp)\n"
                + ")";
    }

    private Connection getConnection() throws SQLException {
        return ds.getConnection();
    }
}
