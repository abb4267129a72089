package com.di.phaselink.bus;

import java.util.Objects;

/**
 * Topic and subscription naming. Every name is a pure function of the prefix and the stage's
 * phase / content / destination labels, so producers and consumers never exchange names.
 *
 * <pre>
 * completion   {prefix}-phase{N}-{content}-complete
 * dead-letter  {completion}-dlq
 * fallback     {prefix}-phase{N}-fallback-trigger
 * main sub     {prefix}-phase{N}-{destinationType}-sub
 * </pre>
 */
public final class TopicNames {

    public static final String SUBSCRIPTION_SUFFIX = "-sub";
    public static final String DLQ_SUFFIX = "-dlq";

    private final String prefix;

    public TopicNames(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public String getPrefix() {
        return prefix;
    }

    public String completionTopic(int phase, String content) {
        return prefix + "-phase" + phase + "-" + content + "-complete";
    }

    public String fallbackTopic(int phase) {
        return prefix + "-phase" + phase + "-fallback-trigger";
    }

    public String mainSubscription(int phase, String destinationType) {
        return prefix + "-phase" + phase + "-" + destinationType + SUBSCRIPTION_SUFFIX;
    }

    public static String deadLetterTopic(String completionTopic) {
        return completionTopic + DLQ_SUFFIX;
    }

    public static String subscriptionFor(String topic) {
        return topic + SUBSCRIPTION_SUFFIX;
    }

    public String fallbackSubscription(int phase) {
        return subscriptionFor(fallbackTopic(phase));
    }

    public static boolean isDeadLetterTopic(String topic) {
        return topic != null && topic.endsWith(DLQ_SUFFIX);
    }
}
