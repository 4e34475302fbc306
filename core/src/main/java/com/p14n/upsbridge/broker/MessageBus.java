package com.p14n.upsbridge.broker;

import java.util.Collection;

/**
 * Thread-safe publish/subscribe client for the message bus.
 *
 * <p>
 * Only {@link #connect(String, BusCredentials)} and {@link #disconnect()}
 * block. Every other operation hands its work to the transport and returns
 * without waiting for the broker, so a caller never stalls on a network round
 * trip.
 * </p>
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Establishes the session and enables automatic reconnect. Intended for
     * startup only.
     *
     * @param address     broker URI, for example {@code tcp://localhost:1883}
     * @param credentials credentials presented to the broker
     * @return true if the initial handshake completed; on false the bus keeps
     *         retrying in the background
     */
    boolean connect(String address, BusCredentials credentials);

    /**
     * Closes the session. Best effort, never throws.
     */
    void disconnect();

    /**
     * Last known connection state. Never blocks; may be stale by one round
     * trip.
     *
     * @return true if the bus is believed to be connected
     */
    boolean isConnected();

    /**
     * Binds a subscriber to a topic pattern. The binding is registered before
     * the network subscribe is issued, and the call does not wait for the
     * broker's acknowledgment.
     *
     * @param pattern    topic pattern, may contain {@code +} and {@code #}
     * @param subscriber subscriber invoked for every matching message
     * @param qos        requested QoS
     * @return false if the bus is disconnected; the binding is kept and
     *         subscribed on the next connect
     */
    boolean subscribe(String pattern, MessageSubscriber<BusMessage> subscriber, int qos);

    /**
     * Subscribes the same subscriber to several patterns.
     *
     * @return true only if every pattern was subscribed
     */
    default boolean subscribeAll(Collection<String> patterns, MessageSubscriber<BusMessage> subscriber, int qos) {
        boolean allSubscribed = true;
        for (String pattern : patterns) {
            allSubscribed &= subscribe(pattern, subscriber, qos);
        }
        return allSubscribed;
    }

    /**
     * Removes the binding for a pattern and asks the broker to drop it.
     *
     * @param pattern the pattern previously passed to subscribe
     * @return false if the bus is disconnected or the pattern was unknown
     */
    boolean unsubscribe(String pattern);

    /**
     * Hands a message to the transport.
     *
     * @return true if the message was accepted for send, false if the bus is
     *         disconnected or the transport refused it
     */
    boolean publish(String topic, String payload, int qos, boolean retained);

    default boolean publish(BusMessage message) {
        return publish(message.topic(), message.payload(), message.qos(), message.retained());
    }

    void addConnectionListener(ConnectionListener listener);

    @Override
    default void close() {
        disconnect();
    }
}
