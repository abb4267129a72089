package com.di.phaselink.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC ({@code stage}, {@code messageId}, {@code invocationId}) from the delivering
 * thread to the threads that run stage invocations, so their logs stay correlated with the message.
 * <p>
 * MDC is thread-local; without propagation, logs from an {@code ExecutorService} do not carry
 * the delivery's keys.
 * <ul>
 *   <li>Wrap before submitting: {@code executor.submit(MdcPropagation.wrapCallable(() -> run()));}</li>
 *   <li>Or wrap the executor once: {@code ExecutorService withMdc = MdcPropagation.wrapExecutor(pool);}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String STAGE = "stage";
    public static final String MESSAGE_ID = "messageId";
    public static final String INVOCATION_ID = "invocationId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of
     * the task on whichever thread runs it, clearing it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /** Callable counterpart of {@link #wrapRunnable(Runnable)}. */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the callable with the given keys set in MDC for its duration (current thread).
     * Used by bus receivers before dispatching to a handler.
     */
    public static <T> T callWithMdcContext(Map<String, String> contextMap, Callable<T> task) throws Exception {
        setMdc(contextMap);
        try {
            return task.call();
        } finally {
            clearMdc(contextMap);
        }
    }

    /** Executor that propagates the submitting thread's MDC into every task. */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /** Copy of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach((k, v) -> {
                if (v != null) {
                    MDC.put(k, v);
                }
            });
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
