package com.warden.observability;

import io.opentelemetry.api.common.AttributeKey;
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
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        spanHelper = new SpanHelper(sdk.getTracer("warden-test"));
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
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should record a span and return the result")
    void shouldRecordSpan() {
        String result = spanHelper.inSpan("warden.v1.RuleTypeService/ListRuleTypes",
                SpanKind.SERVER, Map.of("rpc.system", "grpc"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo("warden.v1.RuleTypeService/ListRuleTypes");
        assertThat(span.getKind()).isEqualTo(SpanKind.SERVER);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("rpc.system"))).isEqualTo("grpc");
    }

    @Test
    @DisplayName("should tag the span with correlation, subject and project")
    void shouldTagWithCorrelationContext() {
        CorrelationContextHolder.set(CorrelationContext.forCall("corr-7", "m")
                .withSubject("alice")
                .withProjectId("p-1"));

        spanHelper.inSpan("work", () -> 1);

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID)))
                .isEqualTo("corr-7");
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_SUBJECT)))
                .isEqualTo("alice");
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_PROJECT_ID)))
                .isEqualTo("p-1");
    }

    @Test
    @DisplayName("should record the exception and rethrow it")
    void shouldRecordException() {
        assertThatThrownBy(() -> spanHelper.inSpan("fails", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
    }
}
