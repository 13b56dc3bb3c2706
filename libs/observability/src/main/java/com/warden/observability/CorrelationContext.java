package com.warden.observability;

import java.util.UUID;

/**
 * Immutable correlation context for one unit of work.
 * <p>
 * A unit of work is either an HTTP request or one run of a scheduler lane. Its identifiers
 * are injected into SLF4J MDC by {@link CorrelationContextHolder} so that every log line
 * written during the work can be grouped back together.
 *
 * @param correlationId unique ID for the unit of work (propagated from {@code X-Correlation-ID} when present)
 * @param origin        what started the work (e.g. {@code http}, {@code scheduler:fast}, {@code operator})
 */
public record CorrelationContext(String correlationId, String origin) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for origin. */
    public static final String MDC_ORIGIN = "origin";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context with a freshly generated correlation ID.
     */
    public static CorrelationContext generate(String origin) {
        return new CorrelationContext(UUID.randomUUID().toString(), origin);
    }
}
