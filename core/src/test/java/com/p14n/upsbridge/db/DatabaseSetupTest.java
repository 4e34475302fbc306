package com.p14n.upsbridge.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class DatabaseSetupTest {

    private DataSource ds;
    private Statement stmt;

    @BeforeEach
    public void setUp() throws SQLException {
        ds = mock(DataSource.class);
        Connection conn = mock(Connection.class);
        stmt = mock(Statement.class);
        when(ds.getConnection()).thenReturn(conn);
        when(conn.createStatement()).thenReturn(stmt);
    }

    @Test
    public void setupCreatesTablesAndIndex() throws SQLException {
        new DatabaseSetup(ds).setupAll();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(stmt, times(3)).execute(sql.capture());
        assertTrue(sql.getAllValues().get(0).contains("CREATE TABLE IF NOT EXISTS ups_devices"));
        assertTrue(sql.getAllValues().get(1).contains("CREATE TABLE IF NOT EXISTS ups_metrics"));
        assertTrue(sql.getAllValues().get(2).contains("idx_ups_metrics_device_time"));
    }

    @Test
    public void metricsTableHasOneColumnPerPersistedField() {
        String ddl = DatabaseSetup.metricsTableDdl();

        assertTrue(ddl.contains("battery_charge DOUBLE PRECISION"));
        assertTrue(ddl.contains("battery_runtime INTEGER"));
        assertTrue(ddl.contains("power_failure BOOLEAN"));
        assertTrue(ddl.contains("ups_status VARCHAR(255)"));
        assertTrue(ddl.contains("UNIQUE (device_id, timestamp)"));
        assertFalse(ddl.contains("firmware_version"));
        assertFalse(ddl.contains("driver_name"));
    }

    @Test
    public void failureIsRethrown() throws SQLException {
        when(stmt.execute(anyString())).thenThrow(new SQLException("permission denied"));

        RuntimeException e = assertThrows(RuntimeException.class, () -> new DatabaseSetup(ds).setupAll());
        assertInstanceOf(SQLException.class, e.getCause());
    }

    @Test
    public void insertStatementBindsEveryColumn() {
        long placeholders = SQL.INSERT_METRICS.chars().filter(c -> c == '?').count();

        assertEquals(SQL.METRIC_FIELDS.size() + 2, placeholders);
        assertTrue(SQL.INSERT_METRICS.contains("ON CONFLICT (device_id, timestamp) DO UPDATE"));
    }
}
