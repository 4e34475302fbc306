package com.p14n.upsbridge.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.FieldType;
import com.p14n.upsbridge.data.UpsField;

/**
 * Statements and column mapping for the device and metrics tables.
 *
 * <p>
 * Every field marked {@link UpsField#persisted()} has a column of the same
 * name in {@code ups_metrics}.
 * </p>
 */
public class SQL {

    private SQL() {
    }

    /** Persisted fields, in column order. */
    public static final List<UpsField> METRIC_FIELDS = Arrays.stream(UpsField.values())
            .filter(UpsField::persisted)
            .collect(Collectors.toUnmodifiableList());

    public static final String METRIC_COLS = METRIC_FIELDS.stream()
            .map(UpsField::topicName)
            .collect(Collectors.joining(", "));

    public static final String SELECT_DEVICE_ID = "SELECT device_id FROM ups_devices WHERE device_identifier = ?";

    public static final String UPSERT_DEVICE = """
            INSERT INTO ups_devices (device_identifier, display_name) VALUES (?, ?)
            ON CONFLICT (device_identifier) DO UPDATE SET display_name = EXCLUDED.display_name
            RETURNING device_id""";

    public static final String INSERT_METRICS = "INSERT INTO ups_metrics (device_id, timestamp, " + METRIC_COLS
            + ") VALUES (?, ?, " + placeholders(METRIC_FIELDS.size())
            + ") ON CONFLICT (device_id, timestamp) DO UPDATE SET "
            + METRIC_FIELDS.stream()
                    .map(f -> f.topicName() + " = EXCLUDED." + f.topicName())
                    .collect(Collectors.joining(", "));

    static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    static String columnType(FieldType type) {
        switch (type) {
            case DECIMAL:
                return "DOUBLE PRECISION";
            case INTEGER:
                return "INTEGER";
            case FLAG:
                return "BOOLEAN";
            default:
                return "VARCHAR(255)";
        }
    }

    static int sqlType(FieldType type) {
        switch (type) {
            case DECIMAL:
                return Types.DOUBLE;
            case INTEGER:
                return Types.INTEGER;
            case FLAG:
                return Types.BOOLEAN;
            default:
                return Types.VARCHAR;
        }
    }

    /**
     * Binds the device id, the record timestamp and every persisted field.
     * Absent fields are bound as SQL NULL.
     */
    public static void setRecordOnStatement(PreparedStatement stmt, int deviceId, DeviceRecord record)
            throws SQLException {
        stmt.setInt(1, deviceId);
        stmt.setTimestamp(2, Timestamp.from(record.timestamp()));
        int i = 3;
        for (UpsField f : METRIC_FIELDS) {
            Object v = record.get(f).orElse(null);
            if (v == null) {
                stmt.setNull(i, sqlType(f.type()));
            } else {
                stmt.setObject(i, v, sqlType(f.type()));
            }
            i++;
        }
    }
}
