package com.p14n.upsbridge.broker;

/**
 * Interface for message subscribers that can receive messages and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
@FunctionalInterface
public interface MessageSubscriber<T> {

    /**
     * Called for every message whose topic matches a pattern this subscriber is
     * bound to.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when {@link #onMessage(Object)} threw. The error never propagates
     * back into the dispatch path.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }
}
