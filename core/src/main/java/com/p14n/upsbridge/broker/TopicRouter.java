package com.p14n.upsbridge.broker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes incoming messages to the subscribers bound to matching topic
 * patterns.
 *
 * <p>
 * Patterns use MQTT wildcards: {@code +} matches exactly one level and a
 * trailing {@code #} matches the remaining levels, zero or more. A topic may
 * match several patterns, in which case every bound subscriber is invoked.
 * </p>
 *
 * <p>
 * The routing table is guarded by a single lock that is released before any
 * subscriber runs, so a subscriber may safely call back into the router.
 * </p>
 */
public class TopicRouter {

    private static final Logger logger = LoggerFactory.getLogger(TopicRouter.class);

    /**
     * A pattern bound to its subscriber.
     */
    public record Subscription(String pattern, int qos, MessageSubscriber<BusMessage> subscriber) {
    }

    private final Object lock = new Object();
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    /**
     * Binds a subscriber to a pattern, replacing any subscriber previously
     * bound to the same pattern.
     *
     * @return true if the pattern was not bound before
     */
    public boolean register(String pattern, int qos, MessageSubscriber<BusMessage> subscriber) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        synchronized (lock) {
            return subscriptions.put(pattern, new Subscription(pattern, qos, subscriber)) == null;
        }
    }

    public boolean remove(String pattern) {
        synchronized (lock) {
            return subscriptions.remove(pattern) != null;
        }
    }

    public List<Subscription> subscriptions() {
        synchronized (lock) {
            return List.copyOf(subscriptions.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return subscriptions.size();
        }
    }

    /**
     * Delivers a message to every subscriber whose pattern matches its topic.
     * A subscriber that throws is told through
     * {@link MessageSubscriber#onError(Throwable)} and delivery continues with
     * the others.
     *
     * @return the number of subscribers the message was delivered to
     */
    public int dispatch(BusMessage message) {
        List<Subscription> matching = new ArrayList<>();
        synchronized (lock) {
            for (Subscription s : subscriptions.values()) {
                if (matches(message.topic(), s.pattern())) {
                    matching.add(s);
                }
            }
        }
        if (matching.isEmpty()) {
            logger.atDebug().log("No subscriber for topic {}", message.topic());
            return 0;
        }
        for (Subscription s : matching) {
            try {
                s.subscriber().onMessage(message);
            } catch (Exception e) {
                logger.atError()
                        .setCause(e)
                        .log("Subscriber for pattern {} failed on topic {}", s.pattern(), message.topic());
                try {
                    s.subscriber().onError(e);
                } catch (Exception onErrorFailure) {
                    logger.atWarn()
                            .setCause(onErrorFailure)
                            .log("Error handler for pattern {} failed", s.pattern());
                }
            }
        }
        return matching.size();
    }

    /**
     * Tests a concrete topic against a pattern.
     *
     * @param topic   a topic without wildcards
     * @param pattern a pattern, possibly containing {@code +} or a final
     *                {@code #}
     * @return true if the topic matches
     */
    public static boolean matches(String topic, String pattern) {
        if (topic == null || pattern == null) {
            return false;
        }
        String[] topicLevels = topic.split("/", -1);
        String[] patternLevels = pattern.split("/", -1);

        for (int i = 0; i < patternLevels.length; i++) {
            String p = patternLevels[i];
            if (p.equals("#") && i == patternLevels.length - 1) {
                return topicLevels.length >= i;
            }
            if (i >= topicLevels.length) {
                return false;
            }
            if (!p.equals("+") && !p.equals(topicLevels[i])) {
                return false;
            }
        }
        return topicLevels.length == patternLevels.length;
    }
}
