package com.di.phaselink.bus;

import com.di.phaselink.event.ChangeEvent;

import java.util.Map;

/**
 * Durable publish/subscribe between stages. Delivery is at-least-once with no ordering guarantee;
 * a failed delivery is retried with exponential backoff up to the retry ceiling and then moved to
 * the topic's dead-letter topic ({@code {topic}-dlq}).
 *
 * <p>Implementations: {@link LocalEventBus} (in-process, phaselink.bus.type=local) and
 * {@link PubSubEventBus} (Google Cloud Pub/Sub, phaselink.bus.type=pubsub).
 */
public interface EventBus extends AutoCloseable {

    /**
     * Publishes a change event, widening its scope when it would not fit in one message.
     *
     * @return the bus message id, once the bus has durably accepted the message
     */
    String publish(String topic, ChangeEvent event);

    /** Publishes an already-encoded payload (dead-letter replay, forwarding). */
    String publishRaw(String topic, byte[] payload, Map<String, String> attributes);

    /**
     * Registers a handler for a subscription on a topic. The handler is invoked concurrently
     * by up to {@code parallelism} threads.
     */
    void subscribe(String topic, String subscription, int parallelism, MessageHandler handler);

    @Override
    void close();
}
