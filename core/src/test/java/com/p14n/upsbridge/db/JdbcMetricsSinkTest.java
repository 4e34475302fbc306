package com.p14n.upsbridge.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.DeviceRegistry;
import com.p14n.upsbridge.data.UpsField;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class JdbcMetricsSinkTest {

    private static final Instant T0 = Instant.parse("2025-06-01T00:00:00Z");

    private DataSource ds;
    private Connection conn;
    private PreparedStatement selectStmt;
    private PreparedStatement upsertStmt;
    private PreparedStatement insertStmt;
    private ResultSet emptyResult;
    private ResultSet idResult;
    private JdbcMetricsSink sink;

    @BeforeEach
    public void setUp() throws SQLException {
        ds = mock(DataSource.class);
        conn = mock(Connection.class);
        selectStmt = mock(PreparedStatement.class);
        upsertStmt = mock(PreparedStatement.class);
        insertStmt = mock(PreparedStatement.class);
        emptyResult = mock(ResultSet.class);
        idResult = mock(ResultSet.class);

        when(ds.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(SQL.SELECT_DEVICE_ID)).thenReturn(selectStmt);
        when(conn.prepareStatement(SQL.UPSERT_DEVICE)).thenReturn(upsertStmt);
        when(conn.prepareStatement(SQL.INSERT_METRICS)).thenReturn(insertStmt);
        when(selectStmt.executeQuery()).thenReturn(emptyResult);
        when(upsertStmt.executeQuery()).thenReturn(idResult);
        when(emptyResult.next()).thenReturn(false);
        when(idResult.next()).thenReturn(true);
        when(idResult.getInt(1)).thenReturn(7);

        DeviceRegistry registry = new DeviceRegistry(List.of("apc_ups"), Map.of("apc_ups", "apc_bx1000"),
                Map.of("apc_ups", "Office UPS"));
        sink = new JdbcMetricsSink(ds, registry, 3, Duration.ZERO, 5);
    }

    private DeviceRecord record() {
        DeviceRecord r = new DeviceRecord("apc_ups", T0);
        r.applyUpdate("battery_charge", "88", T0);
        r.applyUpdate("ups_status", "OL", T0);
        r.applyUpdate("power_failure", "0", T0);
        return r;
    }

    private int column(UpsField field) {
        return SQL.METRIC_FIELDS.indexOf(field) + 3;
    }

    @Test
    public void unknownDeviceIsCreatedWithItsLabel() throws SQLException {
        assertTrue(sink.insert("apc_bx1000", record()));

        verify(upsertStmt).setString(1, "apc_bx1000");
        verify(upsertStmt).setString(2, "Office UPS");
        verify(insertStmt).setInt(1, 7);
        verify(insertStmt).setTimestamp(2, Timestamp.from(T0));
        verify(insertStmt).executeUpdate();
        assertTrue(sink.isAvailable());
    }

    @Test
    public void presentFieldsAreBoundAndAbsentOnesAreNull() throws SQLException {
        sink.insert("apc_bx1000", record());

        verify(insertStmt).setObject(column(UpsField.BATTERY_CHARGE), 88.0, Types.DOUBLE);
        verify(insertStmt).setObject(column(UpsField.UPS_STATUS), "OL", Types.VARCHAR);
        verify(insertStmt).setObject(column(UpsField.POWER_FAILURE), Boolean.FALSE, Types.BOOLEAN);
        verify(insertStmt).setNull(column(UpsField.BATTERY_RUNTIME), Types.INTEGER);
        verify(insertStmt).setNull(column(UpsField.TEMPERATURE), Types.DOUBLE);
    }

    @Test
    public void existingDeviceIdIsLookedUpOnceAndCached() throws SQLException {
        ResultSet found = mock(ResultSet.class);
        when(found.next()).thenReturn(true);
        when(found.getInt(1)).thenReturn(3);
        when(selectStmt.executeQuery()).thenReturn(found);

        assertTrue(sink.insert("apc_bx1000", record()));
        assertTrue(sink.insert("apc_bx1000", record()));

        verify(conn, times(1)).prepareStatement(SQL.SELECT_DEVICE_ID);
        verify(conn, never()).prepareStatement(SQL.UPSERT_DEVICE);
        verify(insertStmt, times(2)).setInt(1, 3);
    }

    @Test
    public void everyStatementHasQueryTimeout() throws SQLException {
        sink.insert("apc_bx1000", record());

        verify(selectStmt).setQueryTimeout(5);
        verify(upsertStmt).setQueryTimeout(5);
        verify(insertStmt).setQueryTimeout(5);
    }

    @Test
    public void transientFailureIsRetried() throws SQLException {
        when(ds.getConnection())
                .thenThrow(new SQLException("connection refused"))
                .thenThrow(new SQLException("connection refused"))
                .thenReturn(conn);

        assertTrue(sink.insert("apc_bx1000", record()));

        verify(ds, times(3)).getConnection();
        assertTrue(sink.isAvailable());
    }

    @Test
    public void persistentFailureGivesUpAfterMaxAttempts() throws SQLException {
        when(insertStmt.executeUpdate()).thenThrow(new SQLException("disk full"));

        assertFalse(sink.insert("apc_bx1000", record()));

        verify(insertStmt, times(3)).executeUpdate();
        assertFalse(sink.isAvailable());
    }

    @Test
    public void missingReturnedIdIsAnError() throws SQLException {
        when(idResult.next()).thenReturn(false);

        assertThrows(SQLException.class, () -> sink.resolveDeviceId(conn, "apc_bx1000"));
        verify(insertStmt, never()).setInt(eq(1), anyInt());
    }

    @Test
    public void atLeastOneAttemptIsRequired() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcMetricsSink(ds, new DeviceRegistry(), 0, Duration.ZERO, 5));
    }
}
