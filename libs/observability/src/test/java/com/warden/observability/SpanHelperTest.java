package com.warden.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly to collect finished spans.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("warden-test"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should create an OK span and return the result")
    void shouldCreateSpanAndReturnResult() throws Exception {
        String result = spanHelper.withSpan("warden.health.check", () -> "healthy");

        assertThat(result).isEqualTo("healthy");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("warden.health.check");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("should record the exception and re-throw")
    void shouldRecordErrorOnException() {
        assertThatThrownBy(() ->
                spanHelper.withSpan("warden.recovery", () -> {
                    throw new IllegalStateException("queue backend down");
                })
        ).isInstanceOf(IllegalStateException.class).hasMessage("queue backend down");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).contains("queue backend down");
        assertThat(span.getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("should attach correlation id and origin")
    void shouldAttachCorrelationContext() throws Exception {
        CorrelationContextHolder.set(new CorrelationContext("corr-42", "scheduler:fast"));

        spanHelper.withSpan("warden.lane.fast", () -> "ok");

        var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attributes.get(SpanHelper.CORRELATION_ID)).isEqualTo("corr-42");
        assertThat(attributes.get(SpanHelper.ORIGIN)).isEqualTo("scheduler:fast");
    }

    @Test
    @DisplayName("should set kind and custom attributes")
    void shouldSetKindAndAttributes() throws Exception {
        spanHelper.withSpan("warden.api", SpanKind.SERVER,
                Attributes.of(AttributeKey.stringKey("http.route"), "/api/v1/health"), () -> "ok");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getKind()).isEqualTo(SpanKind.SERVER);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("http.route"))).isEqualTo("/api/v1/health");
    }

    @Test
    @DisplayName("lane span should be named after the lane and carry it as an attribute")
    void laneSpanShouldCarryLane() {
        spanHelper.traceLane("medium", () -> { });

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("warden.lane.medium");
        assertThat(span.getAttributes().get(SpanHelper.LANE)).isEqualTo("medium");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("lane failures should be recorded and propagated")
    void laneFailureShouldPropagate() {
        assertThatThrownBy(() ->
                spanHelper.traceLane("daily", () -> {
                    throw new IllegalStateException("report failed");
                })
        ).isInstanceOf(IllegalStateException.class).hasMessage("report failed");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }
}
