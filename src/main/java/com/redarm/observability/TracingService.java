package com.redarm.observability;

import com.redarm.util.NonNulls;
import com.redarm.util.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Creates OpenTelemetry spans through GlobalOpenTelemetry, which the
 * dd-java-agent configures. Only active when datadog.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);
    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.redarm", "1.0.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    /**
     * Execute a function within a custom span.
     * @param spanName Name of the span
     * @param operation Operation to execute
     * @return Result of the operation
     */
    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        Span span = tracer.spanBuilder(Strings.safe(spanName)).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.setAttribute("error.message", Strings.safe(e.getMessage()));
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return NonNulls.nn(
                tracer.spanBuilder(NonNulls.requireNonBlank(spanName, "spanName is required")),
                "Tracer.spanBuilder returned null");
    }
}
