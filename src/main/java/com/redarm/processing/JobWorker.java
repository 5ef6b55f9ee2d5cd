package com.redarm.processing;

import com.redarm.api.messaging.JobTaskMessage;
import com.redarm.api.messaging.QueueCodec;
import com.redarm.api.messaging.QueueMessageDecodeException;
import com.redarm.observability.JobMetrics;
import com.redarm.observability.TracingServiceInterface;
import com.redarm.shared.error.DocumentMetadataException;
import com.redarm.shared.model.Document;
import com.redarm.shared.model.JobUpdate;
import com.redarm.shared.store.DocumentStore;
import com.redarm.shared.store.JobStore;
import com.redarm.util.Emails;
import com.redarm.util.Strings;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives one queue message through the job lifecycle:
 * running, then completed or failed.
 *
 * <ul>
 *   <li>Undecodable messages, or messages without jobId/docId, are dropped
 *       without any job write.</li>
 *   <li>The running write happens before any I/O.</li>
 *   <li>Any error from document lookup or processing marks the job failed
 *       and is then re-thrown unchanged so the queue runtime can redeliver.</li>
 * </ul>
 *
 * Redelivery of the same message recomputes the same result blob path, so
 * processing a message twice is safe.
 */
public abstract class JobWorker {

    private static final Logger logger = LoggerFactory.getLogger(JobWorker.class);

    private final String queueName;
    private final String jobType;
    protected final JobStore jobStore;
    private final DocumentStore documentStore;
    private final QueueCodec codec;
    protected final JobMetrics metrics;
    private final TracingServiceInterface tracing;
    protected final Clock clock;

    protected JobWorker(String queueName, String jobType, JobStore jobStore, DocumentStore documentStore,
                        QueueCodec codec, JobMetrics metrics, TracingServiceInterface tracing, Clock clock) {
        this.queueName = queueName;
        this.jobType = jobType;
        this.jobStore = jobStore;
        this.documentStore = documentStore;
        this.codec = codec;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobType() {
        return jobType;
    }

    /**
     * Handles one raw queue message.
     *
     * @param raw parsed envelope, base64 JSON text or plain JSON text
     * @throws IOException if a blob or OCR call failed; the job is already marked failed
     */
    public void handle(Object raw) throws IOException {
        JobTaskMessage task;
        try {
            task = codec.decode(raw);
        } catch (QueueMessageDecodeException e) {
            logger.error("Dropping undecodable message on queue {}: {}", queueName, e.getMessage());
            metrics.recordPoison(queueName);
            return;
        }

        if (!Strings.hasText(task.getJobId()) || !Strings.hasText(task.getDocId())) {
            logger.error("Dropping message on queue {} without jobId/docId: {}", queueName, task);
            metrics.recordPoison(queueName);
            return;
        }

        MDC.put("job_id", task.getJobId());
        MDC.put("queue", queueName);
        Span span = tracing.spanBuilder("worker." + jobType).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("job.id", task.getJobId());
            span.setAttribute("job.type", jobType);
            run(task);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
            MDC.remove("job_id");
            MDC.remove("queue");
        }
    }

    private void run(JobTaskMessage task) throws IOException {
        String jobId = task.getJobId();
        if (!beforeRunning(task)) {
            return;
        }

        Instant started = clock.instant();
        int attempt = task.getAttempt() != null ? task.getAttempt() : 0;
        try {
            jobStore.updateJob(jobId, JobUpdate.running(attempt, started));
            logger.info("Job {} running (type: {}, attempt: {})", jobId, jobType, attempt);

            Document document = documentStore.getDocument(task.getDocId())
                    .filter(d -> Strings.hasText(d.getSourceBlobName()))
                    .orElseThrow(DocumentMetadataException::missingSourceBlob);

            String resultUri = process(task, document);

            jobStore.updateJob(jobId, JobUpdate.completed(resultUri, clock.instant()));
            metrics.recordCompleted(jobType, Duration.between(started, clock.instant()));
            logger.info("Job {} completed", jobId);
        } catch (Exception e) {
            markFailed(jobId, e, started);
            throw e;
        }
    }

    private void markFailed(String jobId, Exception cause, Instant started) {
        String message = Strings.hasText(cause.getMessage()) ? cause.getMessage() : cause.getClass().getSimpleName();
        logger.error("Job {} failed: {}", jobId, message, cause);
        try {
            jobStore.updateJob(jobId, JobUpdate.failed(message, clock.instant()));
        } catch (RuntimeException writeError) {
            logger.error("Failed to mark job {} as failed", jobId, writeError);
            cause.addSuppressed(writeError);
        }
        metrics.recordFailed(jobType, Duration.between(started, clock.instant()));
    }

    /**
     * Runs before the running write. Returning false ends handling of the
     * message without error; the hook is then responsible for any job write.
     */
    protected boolean beforeRunning(JobTaskMessage task) {
        return true;
    }

    /**
     * Performs the type-specific work and returns the signed result URL.
     */
    protected abstract String process(JobTaskMessage task, Document document) throws IOException;

    /**
     * Owner used for result paths: the message's owner, or the document's
     * owner for messages that do not carry one.
     */
    protected static String ownerOf(JobTaskMessage task, Document document) {
        String owner = Emails.normalize(task.getOwnerEmail());
        return owner.isEmpty() ? Emails.normalize(document.getOwnerEmail()) : owner;
    }

    /**
     * Deterministic result path {@code <owner>/<docId>/<jobId>.<extension>}.
     */
    static String resultBlobName(String ownerEmail, String docId, String jobId, String extension) {
        return ownerEmail + "/" + docId + "/" + jobId + "." + extension;
    }
}
