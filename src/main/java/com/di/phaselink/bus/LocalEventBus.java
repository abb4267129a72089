package com.di.phaselink.bus;

import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.exception.MalformedEventException;
import com.di.phaselink.exception.PipelineException;
import com.di.phaselink.util.MdcPropagation;
import com.di.phaselink.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process bus for a single node and for tests. Each subscription owns a fixed pool of
 * {@code parallelism} threads; redeliveries are scheduled on a shared timer with the
 * {@link DeliveryPolicy} backoff. A message that exhausts the retry ceiling, or is malformed, is
 * re-published on {@code {topic}-dlq} with the failure recorded in its attributes.
 * Publishing to a topic with no subscription drops the message.
 */
@Slf4j
public class LocalEventBus implements EventBus {

    private final ChangeEventCodec codec;
    private final DeliveryPolicy policy;
    private final PipelineMetrics metrics;

    private final Map<String, List<Subscription>> subscriptionsByTopic = new ConcurrentHashMap<>();
    private final ScheduledExecutorService retryScheduler;
    private final AtomicLong sequence = new AtomicLong();
    /** Deliveries queued, running or waiting for a retry. */
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed;

    private record Subscription(String name, String topic, MessageHandler handler, ExecutorService executor) {
    }

    public LocalEventBus(ChangeEventCodec codec, DeliveryPolicy policy, PipelineMetrics metrics) {
        this.codec = codec;
        this.policy = policy;
        this.metrics = metrics;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("bus-retry"));
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
        if (closed) {
            throw new IllegalStateException("Bus is closed");
        }
        String id = "local-" + sequence.incrementAndGet();
        metrics.recordPublish(topic);
        List<Subscription> subs = subscriptionsByTopic.get(topic);
        if (subs == null || subs.isEmpty()) {
            log.debug("[BUS] No subscription on {}; message {} dropped", topic, id);
            return id;
        }
        Map<String, String> attrs = attributes == null ? Map.of() : Map.copyOf(attributes);
        for (Subscription sub : subs) {
            BusMessage message = BusMessage.builder()
                    .id(id)
                    .topic(topic)
                    .subscription(sub.name())
                    .payload(payload)
                    .attributes(attrs)
                    .attempt(1)
                    .build();
            enqueue(sub, message, Duration.ZERO);
        }
        return id;
    }

    @Override
    public void subscribe(String topic, String subscription, int parallelism, MessageHandler handler) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, parallelism), daemonThreads("bus-" + subscription));
        subscriptionsByTopic.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add(new Subscription(subscription, topic, handler, executor));
        log.info("[BUS] Subscribed {} to {} (parallelism={})", subscription, topic, parallelism);
    }

    private void enqueue(Subscription sub, BusMessage message, Duration delay) {
        inFlight.incrementAndGet();
        Runnable run = () -> {
            try {
                dispatch(sub, message);
            } finally {
                inFlight.decrementAndGet();
            }
        };
        try {
            if (delay.isZero()) {
                sub.executor().execute(run);
            } else {
                retryScheduler.schedule(() -> sub.executor().execute(run), delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (RuntimeException e) {
            inFlight.decrementAndGet();
            log.warn("[BUS] Could not schedule delivery of {} to {}: {}", message.getId(), sub.name(), e.toString());
        }
    }

    private void dispatch(Subscription sub, BusMessage message) {
        Map<String, String> mdc = new HashMap<>();
        mdc.put(MdcPropagation.MESSAGE_ID, message.getId());
        try {
            MdcPropagation.callWithMdcContext(mdc, () -> {
                deliver(sub, message);
                return null;
            });
        } catch (Exception e) {
            log.error("[BUS] Delivery bookkeeping failed for {} on {}", message.getId(), sub.name(), e);
        }
    }

    private void deliver(Subscription sub, BusMessage message) {
        try {
            sub.handler().handle(message);
            metrics.recordDelivery(sub.name(), "ack");
        } catch (MalformedEventException e) {
            log.warn("[BUS] Malformed message {} on {}: {}", message.getId(), sub.name(), e.getMessage());
            deadLetter(sub, message, e);
        } catch (Exception e) {
            if (policy.isExhausted(message.getAttempt())) {
                log.warn("[BUS] Message {} on {} failed attempt {}/{}; dead-lettering: {}",
                        message.getId(), sub.name(), message.getAttempt(), policy.getMaxDeliveryAttempts(), e.toString());
                deadLetter(sub, message, e);
                return;
            }
            Duration backoff = policy.backoffAfter(message.getAttempt());
            logRetry(sub, message, e, backoff);
            metrics.recordDelivery(sub.name(), "retry");
            enqueue(sub, message.toBuilder().attempt(message.getAttempt() + 1).build(), backoff);
        }
    }

    private void logRetry(Subscription sub, BusMessage message, Exception e, Duration backoff) {
        if (e instanceof PipelineException pe && pe.getErrorKind() == ErrorKind.NOT_READY) {
            log.info("[BUS] {} on {} deferred (attempt {}), retry in {}ms: {}",
                    message.getId(), sub.name(), message.getAttempt(), backoff.toMillis(), e.getMessage());
        } else {
            log.warn("[BUS] {} on {} failed (attempt {}), retry in {}ms: {}",
                    message.getId(), sub.name(), message.getAttempt(), backoff.toMillis(), e.toString());
        }
    }

    private void deadLetter(Subscription sub, BusMessage message, Exception cause) {
        metrics.recordDelivery(sub.name(), "dead_letter");
        if (TopicNames.isDeadLetterTopic(message.getTopic())) {
            log.error("[BUS] Dead-letter handler {} gave up on {}; message dropped", sub.name(), message.getId(), cause);
            return;
        }
        Map<String, String> attrs = new HashMap<>(message.getAttributes());
        attrs.put(BusAttributes.DLQ_SOURCE_TOPIC, message.getTopic());
        attrs.put(BusAttributes.DLQ_SUBSCRIPTION, sub.name());
        attrs.put(BusAttributes.DLQ_ORIGINAL_MESSAGE_ID, message.getId());
        attrs.put(BusAttributes.DLQ_ATTEMPTS, String.valueOf(message.getAttempt()));
        attrs.put(BusAttributes.DLQ_ERROR_KIND, deadLetterKind(cause).name());
        attrs.put(BusAttributes.DLQ_LAST_ERROR, String.valueOf(cause.getMessage()));
        publishRaw(TopicNames.deadLetterTopic(message.getTopic()), message.getPayload(), attrs);
    }

    static ErrorKind deadLetterKind(Exception cause) {
        ErrorKind kind = ErrorKind.categorize(cause);
        return kind == ErrorKind.MALFORMED_EVENT ? kind : ErrorKind.DELIVERY_EXHAUSTED;
    }

    /**
     * Waits until no delivery is queued, running or pending a retry.
     *
     * @return false on timeout
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    @Override
    public void close() {
        closed = true;
        retryScheduler.shutdownNow();
        subscriptionsByTopic.values().forEach(subs -> subs.forEach(s -> s.executor().shutdownNow()));
        log.info("[BUS] Local bus closed");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
