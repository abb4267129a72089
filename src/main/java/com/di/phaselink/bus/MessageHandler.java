package com.di.phaselink.bus;

/**
 * Processes one delivered message. Returning normally acknowledges it; any exception makes the
 * bus redeliver after backoff, except {@link com.di.phaselink.exception.MalformedEventException}
 * which is dead-lettered at once.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(BusMessage message) throws Exception;
}
