package com.di.phaselink.bus;

import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.exception.BusPublishException;
import com.di.phaselink.exception.MalformedEventException;
import com.di.phaselink.util.MdcPropagation;
import com.di.phaselink.util.PipelineMetrics;
import com.google.api.core.ApiFuture;
import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.core.InstantiatingExecutorProvider;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Google Cloud Pub/Sub bus. Topics and subscriptions are provisioned outside the engine under the
 * names from {@link TopicNames}; the subscription's retry policy supplies the redelivery backoff.
 *
 * <p>The retry ceiling is enforced here: the delivery attempt comes from
 * {@link Subscriber#getDeliveryAttempt} when the subscription has a dead-letter policy, otherwise
 * from a local per-message counter. An exhausted or malformed message is re-published on
 * {@code {topic}-dlq} with the failure in its attributes and then acked.
 */
@Slf4j
public class PubSubEventBus implements EventBus {

    private final String projectId;
    private final ChangeEventCodec codec;
    private final DeliveryPolicy policy;
    private final PipelineMetrics metrics;
    private final Duration publishTimeout;

    private final Map<String, Publisher> publishers = new ConcurrentHashMap<>();
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    /** Attempt counts for subscriptions without a server-side dead-letter policy; cleared on ack. */
    private final Map<String, Integer> localAttempts = new ConcurrentHashMap<>();

    public PubSubEventBus(String projectId, ChangeEventCodec codec, DeliveryPolicy policy,
                          PipelineMetrics metrics, Duration publishTimeout) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("phaselink.bus.pubsub.project-id is required for the pubsub bus");
        }
        this.projectId = projectId;
        this.codec = codec;
        this.policy = policy;
        this.metrics = metrics;
        this.publishTimeout = publishTimeout;
    }

    @Override
    public String publish(String topic, ChangeEvent event) {
        Map<String, String> attributes = new HashMap<>();
        if (event.producingStage() != null) {
            attributes.put(BusAttributes.PRODUCING_STAGE, event.producingStage());
        }
        if (event.contentHash() != null) {
            attributes.put(BusAttributes.CONTENT_HASH, event.contentHash());
        }
        return publishRaw(topic, codec.encode(event), attributes);
    }

    @Override
    public String publishRaw(String topic, byte[] payload, Map<String, String> attributes) {
        Publisher publisher = publishers.computeIfAbsent(topic, this::createPublisher);
        PubsubMessage message = PubsubMessage.newBuilder()
                .setData(ByteString.copyFrom(payload))
                .putAllAttributes(attributes == null ? Map.of() : attributes)
                .build();
        ApiFuture<String> future = publisher.publish(message);
        try {
            String id = future.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordPublish(topic);
            log.debug("[BUS] Published {} to {}", id, topic);
            return id;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusPublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BusPublishException("Publish to " + topic + " was not acknowledged", e);
        }
    }

    private Publisher createPublisher(String topic) {
        try {
            return Publisher.newBuilder(TopicName.of(projectId, topic)).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create publisher for " + topic, e);
        }
    }

    @Override
    public void subscribe(String topic, String subscription, int parallelism, MessageHandler handler) {
        MessageReceiver receiver = (PubsubMessage message, AckReplyConsumer consumer) ->
                receive(topic, subscription, handler, message, consumer);
        Subscriber subscriber = Subscriber.newBuilder(ProjectSubscriptionName.of(projectId, subscription), receiver)
                .setFlowControlSettings(FlowControlSettings.newBuilder()
                        .setMaxOutstandingElementCount((long) Math.max(1, parallelism))
                        .build())
                .setParallelPullCount(1)
                .setExecutorProvider(InstantiatingExecutorProvider.newBuilder()
                        .setExecutorThreadCount(Math.max(1, parallelism))
                        .build())
                .build();
        subscriber.startAsync().awaitRunning();
        subscribers.add(subscriber);
        log.info("[BUS] Subscribed {} to {} (project={}, parallelism={})", subscription, topic, projectId, parallelism);
    }

    private void receive(String topic, String subscription, MessageHandler handler,
                         PubsubMessage message, AckReplyConsumer consumer) {
        String messageId = message.getMessageId();
        BusMessage busMessage = BusMessage.builder()
                .id(messageId)
                .topic(topic)
                .subscription(subscription)
                .payload(message.getData().toByteArray())
                .attributes(Map.copyOf(message.getAttributesMap()))
                .attempt(attemptOf(subscription, message))
                .build();
        Map<String, String> mdc = new HashMap<>();
        mdc.put(MdcPropagation.MESSAGE_ID, messageId);
        try {
            MdcPropagation.callWithMdcContext(mdc, () -> {
                handle(handler, busMessage, consumer);
                return null;
            });
        } catch (Exception e) {
            log.error("[BUS] Receiver failed for {} on {}; nacking", messageId, subscription, e);
            consumer.nack();
        }
    }

    private void handle(MessageHandler handler, BusMessage message, AckReplyConsumer consumer) {
        String key = message.getSubscription() + "/" + message.getId();
        try {
            handler.handle(message);
            localAttempts.remove(key);
            metrics.recordDelivery(message.getSubscription(), "ack");
            consumer.ack();
        } catch (MalformedEventException e) {
            log.warn("[BUS] Malformed message {} on {}: {}", message.getId(), message.getSubscription(), e.getMessage());
            deadLetterAndAck(message, e, consumer, key);
        } catch (Exception e) {
            if (policy.isExhausted(message.getAttempt())) {
                log.warn("[BUS] Message {} on {} failed attempt {}/{}; dead-lettering: {}", message.getId(),
                        message.getSubscription(), message.getAttempt(), policy.getMaxDeliveryAttempts(), e.toString());
                deadLetterAndAck(message, e, consumer, key);
                return;
            }
            log.warn("[BUS] {} on {} failed (attempt {}); nacking: {}",
                    message.getId(), message.getSubscription(), message.getAttempt(), e.toString());
            metrics.recordDelivery(message.getSubscription(), "retry");
            consumer.nack();
        }
    }

    private void deadLetterAndAck(BusMessage message, Exception cause, AckReplyConsumer consumer, String key) {
        metrics.recordDelivery(message.getSubscription(), "dead_letter");
        if (TopicNames.isDeadLetterTopic(message.getTopic())) {
            log.error("[BUS] Dead-letter subscription {} gave up on {}; acking to stop redelivery",
                    message.getSubscription(), message.getId(), cause);
            localAttempts.remove(key);
            consumer.ack();
            return;
        }
        Map<String, String> attrs = new HashMap<>(message.getAttributes());
        attrs.put(BusAttributes.DLQ_SOURCE_TOPIC, message.getTopic());
        attrs.put(BusAttributes.DLQ_SUBSCRIPTION, message.getSubscription());
        attrs.put(BusAttributes.DLQ_ORIGINAL_MESSAGE_ID, message.getId());
        attrs.put(BusAttributes.DLQ_ATTEMPTS, String.valueOf(message.getAttempt()));
        attrs.put(BusAttributes.DLQ_ERROR_KIND, LocalEventBus.deadLetterKind(cause).name());
        attrs.put(BusAttributes.DLQ_LAST_ERROR, String.valueOf(cause.getMessage()));
        try {
            publishRaw(TopicNames.deadLetterTopic(message.getTopic()), message.getPayload(), attrs);
            localAttempts.remove(key);
            consumer.ack();
        } catch (RuntimeException e) {
            // keep the message on the main subscription until the dead-letter topic accepts it
            log.error("[BUS] Could not dead-letter {}; nacking", message.getId(), e);
            consumer.nack();
        }
    }

    private int attemptOf(String subscription, PubsubMessage message) {
        Integer attempt = Subscriber.getDeliveryAttempt(message);
        if (attempt != null) {
            return attempt;
        }
        return localAttempts.merge(subscription + "/" + message.getMessageId(), 1, Integer::sum);
    }

    @Override
    public void close() {
        for (Subscriber subscriber : subscribers) {
            subscriber.stopAsync();
        }
        for (Map.Entry<String, Publisher> e : publishers.entrySet()) {
            try {
                e.getValue().shutdown();
                e.getValue().awaitTermination(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("[BUS] Interrupted while shutting down publisher for {}", e.getKey());
            }
        }
        log.info("[BUS] Pub/Sub bus closed ({} publisher(s), {} subscriber(s))", publishers.size(), subscribers.size());
    }
}
