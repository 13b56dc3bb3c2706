package com.warden.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Starts OpenTelemetry spans for Warden's units of work and stamps them with the
 * correlation context of the calling thread.
 * <p>
 * Scheduler lanes get one span per execution via {@link #traceLane(String, Runnable)}.
 * Anything else goes through {@link #withSpan(String, SpanKind, Attributes, Callable)}.
 * The SDK itself is configured elsewhere; against the bare API every span is a no-op.
 */
public final class SpanHelper {

    public static final AttributeKey<String> CORRELATION_ID = AttributeKey.stringKey("correlation.id");
    public static final AttributeKey<String> ORIGIN = AttributeKey.stringKey("warden.origin");
    public static final AttributeKey<String> LANE = AttributeKey.stringKey("warden.lane");

    static final String LANE_SPAN_PREFIX = "warden.lane.";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * Runs one execution of a monitoring lane inside a span named {@code warden.lane.<lane>}.
     * Runtime exceptions from the lane are recorded and propagate unchanged.
     */
    public void traceLane(String lane, Runnable work) {
        Span span = start(LANE_SPAN_PREFIX + lane, SpanKind.INTERNAL, Attributes.of(LANE, lane));
        try (Scope ignored = span.makeCurrent()) {
            work.run();
            span.setStatus(StatusCode.OK);
        } catch (RuntimeException | Error e) {
            fail(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    public <T> T withSpan(String spanName, Callable<T> work) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Attributes.empty(), work);
    }

    /**
     * Runs {@code work} inside a new span of the given kind. Whatever it throws is recorded
     * on the span and re-thrown.
     */
    public <T> T withSpan(String spanName, SpanKind kind, Attributes attributes, Callable<T> work) throws Exception {
        Span span = start(spanName, kind, attributes);
        try (Scope ignored = span.makeCurrent()) {
            T result = work.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            fail(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Span start(String spanName, SpanKind kind, Attributes attributes) {
        AttributesBuilder stamped = attributes.toBuilder();
        CorrelationContextHolder.get().ifPresent(ctx -> {
            stamped.put(CORRELATION_ID, ctx.correlationId());
            if (ctx.origin() != null) {
                stamped.put(ORIGIN, ctx.origin());
            }
        });
        return tracer.spanBuilder(spanName)
                .setSpanKind(kind)
                .setAllAttributes(stamped.build())
                .startSpan();
    }

    private static void fail(Span span, Throwable failure) {
        String description = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        span.setStatus(StatusCode.ERROR, description);
        span.recordException(failure);
    }
}
