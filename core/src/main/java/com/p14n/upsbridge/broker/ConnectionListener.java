package com.p14n.upsbridge.broker;

/**
 * Observes transitions of the bus connection. Callbacks arrive on transport
 * threads with no bus lock held.
 */
public interface ConnectionListener {

    /**
     * @param reconnect true when the session was re-established after a loss
     */
    default void onConnected(boolean reconnect) {
    }

    default void onConnectionLost(Throwable cause) {
    }
}
