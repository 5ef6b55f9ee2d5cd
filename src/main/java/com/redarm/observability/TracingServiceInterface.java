package com.redarm.observability;

import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Tracing facade with an OpenTelemetry-backed and a no-op implementation.
 */
public interface TracingServiceInterface {
    <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation);
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);
}
