package com.p14n.upsbridge.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Loopback bus: a publish is recorded and delivered synchronously to local
 * subscribers through a {@link TopicRouter}.
 */
public class InMemoryMessageBus implements MessageBus {

    private final TopicRouter router = new TopicRouter();
    private final List<BusMessage> published = new CopyOnWriteArrayList<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<String> subscribeCalls = new CopyOnWriteArrayList<>();
    private final List<String> unsubscribeCalls = new CopyOnWriteArrayList<>();
    private volatile boolean connected;
    private volatile boolean refusePublishes;

    public InMemoryMessageBus(boolean connected) {
        this.connected = connected;
    }

    @Override
    public boolean connect(String address, BusCredentials credentials) {
        setConnected(true);
        return true;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * Changes the connection state and notifies listeners as the real bus
     * would.
     */
    public void setConnected(boolean connected) {
        boolean was = this.connected;
        this.connected = connected;
        for (ConnectionListener l : listeners) {
            if (connected) {
                l.onConnected(was);
            } else if (was) {
                l.onConnectionLost(new RuntimeException("test disconnect"));
            }
        }
    }

    public void setRefusePublishes(boolean refuse) {
        this.refusePublishes = refuse;
    }

    @Override
    public boolean subscribe(String pattern, MessageSubscriber<BusMessage> subscriber, int qos) {
        router.register(pattern, qos, subscriber);
        subscribeCalls.add(pattern);
        return connected;
    }

    @Override
    public boolean unsubscribe(String pattern) {
        unsubscribeCalls.add(pattern);
        return router.remove(pattern) && connected;
    }

    @Override
    public boolean publish(String topic, String payload, int qos, boolean retained) {
        if (!connected || refusePublishes) {
            return false;
        }
        BusMessage m = new BusMessage(topic, payload, qos, retained);
        published.add(m);
        router.dispatch(m);
        return true;
    }

    /**
     * Delivers a message to local subscribers without recording it, as if it
     * came from another client.
     */
    public void deliver(String topic, String payload) {
        router.dispatch(new BusMessage(topic, payload, 1, false));
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public List<BusMessage> published() {
        return new ArrayList<>(published);
    }

    public List<BusMessage> publishedMatching(String pattern) {
        List<BusMessage> matching = new ArrayList<>();
        for (BusMessage m : published) {
            if (TopicRouter.matches(m.topic(), pattern)) {
                matching.add(m);
            }
        }
        return matching;
    }

    public void clearPublished() {
        published.clear();
    }

    public List<String> subscribeCalls() {
        return List.copyOf(subscribeCalls);
    }

    public List<String> unsubscribeCalls() {
        return List.copyOf(unsubscribeCalls);
    }

    public TopicRouter router() {
        return router;
    }
}
