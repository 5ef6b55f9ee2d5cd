package com.redarm.observability;

import com.redarm.util.NonNulls;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * No-op tracing used when Datadog is disabled.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return operation.get();
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return new NoOpSpanBuilder();
    }

    private static class NoOpSpanBuilder implements SpanBuilder {
        @Override
        public SpanBuilder setParent(@Nonnull Context context) { return this; }
        @Override
        public SpanBuilder setNoParent() { return this; }
        @Override
        public SpanBuilder addLink(@Nonnull SpanContext spanContext) { return this; }
        @Override
        public SpanBuilder addLink(@Nonnull SpanContext spanContext, @Nonnull Attributes attributes) { return this; }
        @Override
        public SpanBuilder setAttribute(@Nonnull String key, @Nonnull String value) { return this; }
        @Override
        public SpanBuilder setAttribute(@Nonnull String key, long value) { return this; }
        @Override
        public SpanBuilder setAttribute(@Nonnull String key, double value) { return this; }
        @Override
        public SpanBuilder setAttribute(@Nonnull String key, boolean value) { return this; }
        @Override
        public <T> SpanBuilder setAttribute(@Nonnull AttributeKey<T> key, @Nonnull T value) { return this; }
        @Override
        public SpanBuilder setAllAttributes(@Nonnull Attributes attributes) { return this; }
        @Override
        public SpanBuilder setSpanKind(@Nonnull SpanKind spanKind) { return this; }
        @Override
        public SpanBuilder setStartTimestamp(long timestamp, @Nonnull TimeUnit unit) { return this; }
        @Override
        @Nonnull
        public Span startSpan() {
            return NonNulls.nn(Span.getInvalid(), "Span.getInvalid() returned null");
        }
    }
}
