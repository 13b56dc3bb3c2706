package com.warden.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Binds a {@link CorrelationContext} to the current thread and mirrors it into the SLF4J MDC
 * under {@code correlationId} and {@code origin}.
 * <p>
 * Request threads and scheduler threads are both pooled. A binding made with
 * {@link #set(CorrelationContext)} must be paired with {@link #clear()};
 * {@link #runWithContext(CorrelationContext, Runnable)} does the pairing itself and puts back
 * whatever was bound before.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        MDC.put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        if (context.origin() == null) {
            MDC.remove(CorrelationContext.MDC_ORIGIN);
        } else {
            MDC.put(CorrelationContext.MDC_ORIGIN, context.origin());
        }
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * @return the bound correlation id, or {@code null} outside any unit of work
     */
    public static String currentCorrelationId() {
        return get().map(CorrelationContext::correlationId).orElse(null);
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ORIGIN);
    }

    /**
     * Runs {@code work} under {@code context}, then restores the previous binding even when
     * {@code work} throws.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        CorrelationContext previous = CURRENT.get();
        set(context);
        try {
            work.run();
        } finally {
            if (previous == null) {
                clear();
            } else {
                set(previous);
            }
        }
    }
}
