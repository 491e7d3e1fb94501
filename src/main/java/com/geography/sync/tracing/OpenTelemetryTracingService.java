package com.geography.sync.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} over the OpenTelemetry API. The SDK and exporter are
 * chosen by the host application.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String OPERATION_ATTRIBUTE = "geo.operation";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span start(SyncOperation operation, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName());
        builder.setAttribute(OPERATION_ATTRIBUTE, operation.name());
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private record OTelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void succeeded() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
