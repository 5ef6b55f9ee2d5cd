package com.redarm.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redarm.api.messaging.JobTaskMessage;
import com.redarm.api.messaging.QueueCodec;
import com.redarm.api.messaging.QueueTransport;
import com.redarm.config.QueueSettings;
import com.redarm.observability.JobMetrics;
import com.redarm.observability.TracingServiceInterface;
import com.redarm.security.Identity;
import com.redarm.shared.dto.JobAcceptedResponse;
import com.redarm.shared.error.AuthException;
import com.redarm.shared.error.NotFoundException;
import com.redarm.shared.error.ValidationException;
import com.redarm.shared.model.Document;
import com.redarm.shared.model.Job;
import com.redarm.shared.model.JobType;
import com.redarm.shared.store.DocumentStore;
import com.redarm.shared.store.JobStore;
import com.redarm.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Starts export and OCR jobs for a document the caller owns.
 *
 * The job row is written before the queue message is sent, so a worker never
 * sees a message whose job does not exist yet. Neither step is retried here;
 * a failure surfaces as a server error and the caller retries the request.
 */
@Service
public class JobInitiationService {

    private static final Logger logger = LoggerFactory.getLogger(JobInitiationService.class);
    private static final Pattern PAGES_PATTERN = Pattern.compile("^[0-9,\\-]*$");
    private static final int MAX_PAGES_LENGTH = 255;

    static final String UNSUPPORTED_FORMAT = "Only pdf export format is supported";
    static final String INVALID_PAGES = "pages must contain only digits, commas, and dashes";

    private final JobStore jobStore;
    private final DocumentStore documentStore;
    private final QueueTransport queueTransport;
    private final QueueCodec codec;
    private final QueueSettings queueSettings;
    private final ObjectMapper objectMapper;
    private final JobMetrics metrics;
    private final TracingServiceInterface tracing;
    private final Clock clock;

    public JobInitiationService(JobStore jobStore, DocumentStore documentStore, QueueTransport queueTransport,
                                QueueCodec codec, QueueSettings queueSettings, ObjectMapper objectMapper,
                                JobMetrics metrics, TracingServiceInterface tracing, Clock clock) {
        this.jobStore = jobStore;
        this.documentStore = documentStore;
        this.queueTransport = queueTransport;
        this.codec = codec;
        this.queueSettings = queueSettings;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    public JobAcceptedResponse startExport(Identity identity, String docId, String body) {
        return tracing.trace("job.initiate", () -> {
            Document document = requireOwnedDocument(identity, docId);
            String format = parseFormat(parseBody(body));

            Job job = newJob(JobType.EXPORT, document, identity);
            job.setRequestedFormat(format);
            JobTaskMessage message = JobTaskMessage.export(job.getJobId(), job.getDocId(), job.getOwnerEmail(),
                    job.getCreatedAt().toString(), format);
            return createAndEnqueue(job, message, queueSettings.getExportQueue());
        });
    }

    public JobAcceptedResponse startOcr(Identity identity, String docId, String body) {
        return tracing.trace("job.initiate", () -> {
            Document document = requireOwnedDocument(identity, docId);
            String pages = parsePages(parseBody(body));

            Job job = newJob(JobType.OCR, document, identity);
            job.setPages(pages);
            JobTaskMessage message = JobTaskMessage.ocr(job.getJobId(), job.getDocId(), job.getOwnerEmail(),
                    job.getCreatedAt().toString(), pages);
            return createAndEnqueue(job, message, queueSettings.getOcrQueue());
        });
    }

    private Document requireOwnedDocument(Identity identity, String docId) {
        Document document = documentStore.getDocument(docId)
                .orElseThrow(() -> new NotFoundException("Document not found"));
        if (!identity.owns(document.getOwnerEmail())) {
            logger.warn("User {} attempted to start a job on document {} owned by someone else",
                    identity.getEmail(), docId);
            throw AuthException.forbidden("You do not own this document");
        }
        return document;
    }

    private Job newJob(String type, Document document, Identity identity) {
        Instant now = clock.instant();
        return Job.queued(UUID.randomUUID().toString(), type, document.getDocId(), identity.getEmail(), now);
    }

    private JobAcceptedResponse createAndEnqueue(Job job, JobTaskMessage message, String queueName) {
        jobStore.createJob(job);
        queueTransport.sendQueueMessage(queueName, codec.encode(message));
        metrics.recordCreated(job.getType());
        logger.info("Job {} queued on {} (type: {}, docId: {})", job.getJobId(), queueName, job.getType(), job.getDocId());
        return new JobAcceptedResponse(job.getJobId());
    }

    /**
     * Reads the request body as a JSON object. Blank, unparsable or
     * non-object bodies are treated as an empty object.
     */
    ObjectNode parseBody(String body) {
        if (!Strings.hasText(body)) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unparsable request body: {}", e.getOriginalMessage());
        }
        return objectMapper.createObjectNode();
    }

    static String parseFormat(JsonNode body) {
        JsonNode node = body.get("format");
        if (node == null || node.isNull()) {
            return "pdf";
        }
        if (node.isContainerNode()) {
            throw new ValidationException(UNSUPPORTED_FORMAT);
        }
        String format = node.asText().trim().toLowerCase(Locale.ROOT);
        if (format.isEmpty()) {
            return "pdf";
        }
        if (!"pdf".equals(format)) {
            throw new ValidationException(UNSUPPORTED_FORMAT);
        }
        return format;
    }

    static String parsePages(JsonNode body) {
        JsonNode node = body.get("pages");
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isContainerNode()) {
            throw new ValidationException(INVALID_PAGES);
        }
        String pages = node.asText().trim();
        if (!PAGES_PATTERN.matcher(pages).matches()) {
            throw new ValidationException(INVALID_PAGES);
        }
        if (pages.length() > MAX_PAGES_LENGTH) {
            throw new ValidationException("pages must be at most " + MAX_PAGES_LENGTH + " characters");
        }
        return pages;
    }
}
