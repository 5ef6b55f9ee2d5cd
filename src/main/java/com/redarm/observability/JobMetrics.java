package com.redarm.observability;

import com.redarm.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Job lifecycle metrics.
 *
 * - redarm.job.created: jobs accepted by a start request, by type
 * - redarm.job.completed / redarm.job.failed: terminal writes by workers, by type
 * - redarm.job.duration: worker processing time, by type and outcome
 * - redarm.queue.poison: dropped queue messages, by queue
 */
@Component
public class JobMetrics {

    private static final Logger logger = LoggerFactory.getLogger(JobMetrics.class);

    private final MeterRegistry meterRegistry;

    public JobMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordCreated(String type) {
        counter("redarm.job.created", "Jobs accepted for processing", "type", type).increment();
    }

    public void recordCompleted(String type, Duration duration) {
        counter("redarm.job.completed", "Jobs completed successfully", "type", type).increment();
        recordDuration(type, "completed", duration);
    }

    public void recordFailed(String type, Duration duration) {
        counter("redarm.job.failed", "Jobs marked failed", "type", type).increment();
        if (duration != null) {
            recordDuration(type, "failed", duration);
        }
    }

    public void recordPoison(String queue) {
        counter("redarm.queue.poison", "Queue messages dropped as undeliverable", "queue", queue).increment();
        logger.debug("Recorded poison message for queue={}", queue);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag("service", "redarm-jobs")
                .tag(tagKey, Strings.safe(tagValue))
                .register(meterRegistry);
    }

    private void recordDuration(String type, String outcome, Duration duration) {
        Timer.builder("redarm.job.duration")
                .description("Worker processing duration")
                .tag("service", "redarm-jobs")
                .tag("type", Strings.safe(type))
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(duration);
    }
}
