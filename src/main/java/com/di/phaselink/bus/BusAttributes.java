package com.di.phaselink.bus;

/** Message attribute names set by the bus. */
public final class BusAttributes {

    public static final String PRODUCING_STAGE = "producing_stage";
    public static final String CONTENT_HASH = "content_hash";

    // set on dead-lettered copies
    public static final String DLQ_SOURCE_TOPIC = "dlq.source_topic";
    public static final String DLQ_SUBSCRIPTION = "dlq.subscription";
    public static final String DLQ_ORIGINAL_MESSAGE_ID = "dlq.original_message_id";
    public static final String DLQ_LAST_ERROR = "dlq.last_error";
    public static final String DLQ_ERROR_KIND = "dlq.error_kind";
    public static final String DLQ_ATTEMPTS = "dlq.attempts";

    private BusAttributes() {
    }
}
