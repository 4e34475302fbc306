package com.p14n.upsbridge.broker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.upsbridge.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;

/**
 * {@link MessageBus} over MQTT using the Eclipse Paho asynchronous client.
 *
 * <p>
 * The connection state (client handle and connected flag) changes only under
 * {@code connectionLock}, and every read of it is lock-free. Network calls
 * are always issued outside the lock, so a publish stalled inside the
 * transport never holds up {@link #isConnected()} or another caller.
 * </p>
 *
 * <p>
 * Incoming messages are handed to a {@link TopicRouter}. Subscriptions are
 * registered in the router before the network subscribe is sent, so messages
 * that arrive ahead of the broker's acknowledgment still find their
 * subscriber. Every registered pattern is subscribed again whenever a session
 * is established, since clean sessions lose broker-side state.
 * </p>
 */
public class MqttMessageBus implements MessageBus {

    private static final Logger logger = LoggerFactory.getLogger(MqttMessageBus.class);

    static final int KEEP_ALIVE_SECONDS = 60;
    static final int MAX_RECONNECT_DELAY_MS = 64_000;
    // room for a full discovery burst plus a state burst while acks lag
    static final int MAX_INFLIGHT = 1000;

    /**
     * Creates the underlying transport client.
     */
    @FunctionalInterface
    public interface ClientFactory {
        IMqttAsyncClient create(String serverUri, String clientId) throws MqttException;
    }

    private final String clientId;
    private final ClientFactory clientFactory;
    private final AsyncExecutor executor;
    private final Duration connectTimeout;
    private final BusMetrics metrics;
    private final TopicRouter router = new TopicRouter();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final Object connectionLock = new Object();
    private volatile IMqttAsyncClient client;
    private volatile boolean connected;
    private MqttConnectOptions options;
    private ScheduledFuture<?> retryFuture;
    private final AtomicBoolean wanted = new AtomicBoolean(false);
    private final AtomicInteger retryAttempt = new AtomicInteger();

    public MqttMessageBus(String clientId, OpenTelemetry ot) {
        this(clientId,
                (uri, id) -> new MqttAsyncClient(uri, id, new MemoryPersistence()),
                new DefaultExecutor(1),
                ot,
                Duration.ofSeconds(10));
    }

    /**
     * @param clientId       base client id; a {@code _<epoch-seconds>} suffix is
     *                       added on connect
     * @param clientFactory  creates the transport client
     * @param executor       runs background connect retries
     * @param ot             OpenTelemetry instance for metrics
     * @param connectTimeout bound on the initial handshake
     */
    public MqttMessageBus(String clientId, ClientFactory clientFactory, AsyncExecutor executor,
            OpenTelemetry ot, Duration connectTimeout) {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalArgumentException("Client id cannot be null or empty");
        }
        this.clientId = clientId;
        this.clientFactory = clientFactory;
        this.executor = executor;
        this.connectTimeout = connectTimeout;
        this.metrics = new BusMetrics(ot.getMeter("com.p14n.upsbridge.broker"));
    }

    @Override
    public boolean connect(String address, BusCredentials credentials) {
        IMqttAsyncClient c;
        synchronized (connectionLock) {
            if (client == null) {
                String sessionId = clientId + "_" + (System.currentTimeMillis() / 1000);
                try {
                    client = clientFactory.create(address, sessionId);
                } catch (MqttException e) {
                    logger.atError().setCause(e).log("Unable to create MQTT client for {}", address);
                    return false;
                }
                client.setCallback(new Callback());
            }
            options = connectOptions(credentials);
            c = client;
        }
        wanted.set(true);
        logger.atInfo().log("Connecting to MQTT broker at {}", address);
        if (attemptConnect(c)) {
            return true;
        }
        scheduleRetry();
        return false;
    }

    private MqttConnectOptions connectOptions(BusCredentials credentials) {
        MqttConnectOptions o = new MqttConnectOptions();
        o.setCleanSession(true);
        o.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        o.setAutomaticReconnect(true);
        o.setMaxReconnectDelay(MAX_RECONNECT_DELAY_MS);
        o.setMaxInflight(MAX_INFLIGHT);
        o.setConnectionTimeout((int) Math.max(1, connectTimeout.toSeconds()));
        if (credentials != null && credentials.hasUsername()) {
            o.setUserName(credentials.username());
            o.setPassword(credentials.passwordChars());
        }
        return o;
    }

    private boolean attemptConnect(IMqttAsyncClient c) {
        MqttConnectOptions o;
        synchronized (connectionLock) {
            o = options;
        }
        try {
            c.connect(o).waitForCompletion(connectTimeout.toMillis());
        } catch (MqttException e) {
            logger.atWarn().log("MQTT connect failed: {}", e.getMessage());
            return false;
        }
        synchronized (connectionLock) {
            if (client != c) {
                return false;
            }
            connected = true;
        }
        retryAttempt.set(0);
        logger.atInfo().log("Connected to MQTT broker at {}", c.getServerURI());
        return true;
    }

    private void scheduleRetry() {
        if (!wanted.get()) {
            return;
        }
        Duration delay = Backoff.next(retryAttempt.getAndIncrement());
        logger.atInfo().log("Retrying MQTT connect in {} ms", delay.toMillis());
        synchronized (connectionLock) {
            retryFuture = executor.schedule(this::retryConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void retryConnect() {
        IMqttAsyncClient c = client;
        if (!wanted.get() || c == null) {
            return;
        }
        if (isConnected()) {
            return;
        }
        if (!attemptConnect(c)) {
            scheduleRetry();
        }
    }

    @Override
    public void disconnect() {
        wanted.set(false);
        IMqttAsyncClient c;
        synchronized (connectionLock) {
            if (retryFuture != null) {
                retryFuture.cancel(false);
                retryFuture = null;
            }
            c = client;
            client = null;
            connected = false;
        }
        if (c == null) {
            return;
        }
        try {
            if (c.isConnected()) {
                c.disconnect().waitForCompletion(connectTimeout.toMillis());
            }
        } catch (MqttException e) {
            logger.atWarn().setCause(e).log("Error while disconnecting from MQTT broker");
        }
        try {
            c.close();
        } catch (MqttException e) {
            logger.atWarn().setCause(e).log("Error while closing MQTT client");
        }
        logger.atInfo().log("Disconnected from MQTT broker");
    }

    @Override
    public boolean isConnected() {
        IMqttAsyncClient c = client;
        return connected && c != null && c.isConnected();
    }

    private IMqttAsyncClient connectedClient() {
        IMqttAsyncClient c = client;
        if (!connected || c == null || !c.isConnected()) {
            return null;
        }
        return c;
    }

    @Override
    public boolean subscribe(String pattern, MessageSubscriber<BusMessage> subscriber, int qos) {
        if (router.register(pattern, qos, subscriber)) {
            metrics.recordSubscriptionAdded(pattern);
        }
        IMqttAsyncClient c = connectedClient();
        if (c == null) {
            logger.atDebug().log("Not connected, {} will be subscribed on connect", pattern);
            return false;
        }
        return sendSubscribe(c, pattern, qos);
    }

    private boolean sendSubscribe(IMqttAsyncClient c, String pattern, int qos) {
        try {
            c.subscribe(pattern, qos);
            logger.atDebug().log("Subscribe sent for {}", pattern);
            return true;
        } catch (MqttException e) {
            logger.atWarn().setCause(e).log("Subscribe failed for {}", pattern);
            return false;
        }
    }

    @Override
    public boolean unsubscribe(String pattern) {
        boolean removed = router.remove(pattern);
        if (removed) {
            metrics.recordSubscriptionRemoved(pattern);
        }
        IMqttAsyncClient c = connectedClient();
        if (c == null || !removed) {
            return false;
        }
        try {
            c.unsubscribe(pattern);
            return true;
        } catch (MqttException e) {
            logger.atWarn().setCause(e).log("Unsubscribe failed for {}", pattern);
            return false;
        }
    }

    @Override
    public boolean publish(String topic, String payload, int qos, boolean retained) {
        BusMessage message = new BusMessage(topic, payload, qos, retained);
        IMqttAsyncClient c = connectedClient();
        if (c == null) {
            metrics.recordPublishFailure(topic);
            logger.atDebug().log("Not connected, dropping publish to {}", topic);
            return false;
        }
        try {
            c.publish(topic, message.payloadBytes(), qos, retained);
            metrics.recordPublished(topic);
            return true;
        } catch (MqttException e) {
            metrics.recordPublishFailure(topic);
            logger.atWarn().log("Publish to {} failed: {}", topic, e.getMessage());
            return false;
        }
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void close() {
        disconnect();
        executor.shutdownNow();
    }

    TopicRouter router() {
        return router;
    }

    private void resubscribeAll(IMqttAsyncClient c) {
        for (TopicRouter.Subscription s : router.subscriptions()) {
            sendSubscribe(c, s.pattern(), s.qos());
        }
    }

    private class Callback implements MqttCallbackExtended {

        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            IMqttAsyncClient c;
            synchronized (connectionLock) {
                c = client;
                if (c == null) {
                    return;
                }
                connected = true;
            }
            retryAttempt.set(0);
            logger.atInfo().log("MQTT session established with {} (reconnect={})", serverURI, reconnect);
            resubscribeAll(c);
            for (ConnectionListener l : listeners) {
                try {
                    l.onConnected(reconnect);
                } catch (Exception e) {
                    logger.atError().setCause(e).log("Connection listener failed");
                }
            }
        }

        @Override
        public void connectionLost(Throwable cause) {
            synchronized (connectionLock) {
                connected = false;
            }
            logger.atWarn().log("MQTT connection lost: {}", cause == null ? "unknown" : cause.getMessage());
            for (ConnectionListener l : listeners) {
                try {
                    l.onConnectionLost(cause);
                } catch (Exception e) {
                    logger.atError().setCause(e).log("Connection listener failed");
                }
            }
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            // an exception thrown here would make Paho drop the connection
            try {
                BusMessage m = BusMessage.of(topic, message.getPayload(), message.getQos(), message.isRetained());
                if (router.dispatch(m) > 0) {
                    metrics.recordReceived(topic);
                }
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Failed to dispatch message on {}", topic);
            }
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
        }
    }
}
