package com.p14n.upsbridge.bridge;

import java.util.Map;

/**
 * A source of raw UPS variables.
 */
public interface TelemetrySource extends AutoCloseable {

    boolean connect();

    void disconnect();

    boolean isConnected();

    /**
     * Reads every variable the device reports.
     *
     * @return variable name to value; empty on any transient failure
     */
    Map<String, String> fetchAll();

    @Override
    default void close() {
        disconnect();
    }
}
