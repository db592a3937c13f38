package net.terminus.Kafka.Tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

public class OpenTelemetryTracingSpan implements TracingSpan {

    static final String PRODUCE_ATTEMPTS = "terminus.dlq.produce_attempts";

    private final Span span;

    public OpenTelemetryTracingSpan(Span span) {
        this.span = span;
    }

    @Override
    public TracingSpan setAttribute(String key, String value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public TracingSpan setProduceAttempts(int attempts) {
        span.setAttribute(PRODUCE_ATTEMPTS, (long) attempts);
        return this;
    }

    @Override
    public TracingSpan recordException(Throwable exception) {
        span.recordException(exception);
        // delivery exceptions carry the message id in their message
        span.setStatus(StatusCode.ERROR, exception.getClass().getSimpleName() + ": " + exception.getMessage());
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        span.setStatus(StatusCode.OK);
        return this;
    }

    @Override
    public void end() {
        span.end();
    }
}
