package com.p14n.upsbridge.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for message bus operations.
 *
 * <p>
 * This class provides four metrics:
 * </p>
 * <ul>
 * <li>messages_published: messages accepted by the transport, per topic</li>
 * <li>messages_received: messages delivered to at least one subscriber, per
 * topic</li>
 * <li>publish_failures: publishes refused or failed, per topic</li>
 * <li>active_subscriptions: registered topic patterns</li>
 * </ul>
 */
public class BusMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongCounter publishFailures;
        private final LongUpDownCounter activeSubscriptions;

        /**
         * Creates a new BusMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BusMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages accepted for send")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages delivered to subscribers")
                                .build();

                publishFailures = meter.counterBuilder("publish_failures")
                                .setDescription("Number of publishes refused or failed")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of registered topic patterns")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordReceived(String topic) {
                receivedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordPublishFailure(String topic) {
                publishFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionAdded(String pattern) {
                activeSubscriptions.add(1, Attributes.of(TOPIC, pattern));
        }

        public void recordSubscriptionRemoved(String pattern) {
                activeSubscriptions.add(-1, Attributes.of(TOPIC, pattern));
        }
}
