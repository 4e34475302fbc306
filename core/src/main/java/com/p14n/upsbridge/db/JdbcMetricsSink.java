package com.p14n.upsbridge.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.upsbridge.collector.MetricsSink;
import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.DeviceRegistry;

/**
 * Writes device snapshots to PostgreSQL, one row per device per timestamp.
 *
 * <p>
 * The numeric device id for a storage key is looked up once and cached; a
 * device without a row is created with its registry label. Each insert is
 * tried up to {@code maxAttempts} times.
 * </p>
 */
public class JdbcMetricsSink implements MetricsSink {

    private static final Logger logger = LoggerFactory.getLogger(JdbcMetricsSink.class);

    private final DataSource ds;
    private final DeviceRegistry registry;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final int queryTimeoutSeconds;
    private final ConcurrentHashMap<String, Integer> deviceIds = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    public JdbcMetricsSink(DataSource ds, DeviceRegistry registry) {
        this(ds, registry, 3, Duration.ofSeconds(1), 10);
    }

    public JdbcMetricsSink(DataSource ds, DeviceRegistry registry, int maxAttempts, Duration retryDelay,
            int queryTimeoutSeconds) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.ds = ds;
        this.registry = registry;
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public boolean insert(String storageKey, DeviceRecord record) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Connection conn = ds.getConnection()) {
                int deviceId = resolveDeviceId(conn, storageKey);
                try (PreparedStatement stmt = conn.prepareStatement(SQL.INSERT_METRICS)) {
                    stmt.setQueryTimeout(queryTimeoutSeconds);
                    SQL.setRecordOnStatement(stmt, deviceId, record);
                    stmt.executeUpdate();
                }
                available = true;
                logger.atDebug().log("Inserted metrics for {} at {}", storageKey, record.timestamp());
                return true;
            } catch (SQLException e) {
                available = false;
                logger.atWarn().log("Insert for {} failed (attempt {}/{}): {}", storageKey, attempt, maxAttempts,
                        e.getMessage());
                if (attempt < maxAttempts && !pause()) {
                    break;
                }
            }
        }
        logger.atError().log("Insert for {} failed after {} attempts", storageKey, maxAttempts);
        return false;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    int resolveDeviceId(Connection conn, String storageKey) throws SQLException {
        Integer cached = deviceIds.get(storageKey);
        if (cached != null) {
            return cached;
        }
        try (PreparedStatement stmt = conn.prepareStatement(SQL.SELECT_DEVICE_ID)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, storageKey);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    int id = rs.getInt(1);
                    deviceIds.put(storageKey, id);
                    return id;
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(SQL.UPSERT_DEVICE)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, storageKey);
            stmt.setString(2, registry.labelForStorageKey(storageKey));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("No device id returned for " + storageKey);
                }
                int id = rs.getInt(1);
                deviceIds.put(storageKey, id);
                logger.atInfo().log("Registered device {} with id {}", storageKey, id);
                return id;
            }
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
