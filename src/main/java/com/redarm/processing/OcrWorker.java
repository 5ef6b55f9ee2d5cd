package com.redarm.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redarm.api.messaging.JobTaskMessage;
import com.redarm.api.messaging.QueueCodec;
import com.redarm.api.storage.BlobStore;
import com.redarm.config.BlobSettings;
import com.redarm.config.QueueSettings;
import com.redarm.observability.JobMetrics;
import com.redarm.observability.TracingServiceInterface;
import com.redarm.shared.model.Document;
import com.redarm.shared.model.JobType;
import com.redarm.shared.model.JobUpdate;
import com.redarm.shared.store.DocumentStore;
import com.redarm.shared.store.JobStore;
import com.redarm.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;

/**
 * Runs text recognition on the source PDF and stores the analysis as a JSON
 * blob in the OCR container.
 */
@Service
public class OcrWorker extends JobWorker {

    private static final Logger logger = LoggerFactory.getLogger(OcrWorker.class);
    public static final String NOT_CONFIGURED = "Document Intelligence not configured";

    private final BlobStore blobStore;
    private final BlobSettings blobSettings;
    private final OcrClient ocrClient;
    private final ObjectMapper objectMapper;

    public OcrWorker(QueueSettings queueSettings, JobStore jobStore, DocumentStore documentStore,
                     BlobStore blobStore, BlobSettings blobSettings, OcrClient ocrClient, ObjectMapper objectMapper,
                     QueueCodec codec, JobMetrics metrics, TracingServiceInterface tracing, Clock clock) {
        super(queueSettings.getOcrQueue(), JobType.OCR, jobStore, documentStore, codec, metrics, tracing, clock);
        this.blobStore = blobStore;
        this.blobSettings = blobSettings;
        this.ocrClient = ocrClient;
        this.objectMapper = objectMapper;
    }

    /**
     * An unconfigured backend is an expected outcome: the job is failed once
     * and the message completes normally.
     */
    @Override
    protected boolean beforeRunning(JobTaskMessage task) {
        if (ocrClient.isConfigured()) {
            return true;
        }
        logger.warn("OCR backend not configured; failing job {}", task.getJobId());
        jobStore.updateJob(task.getJobId(), JobUpdate.failed(NOT_CONFIGURED, clock.instant()));
        metrics.recordFailed(getJobType(), null);
        return false;
    }

    @Override
    protected String process(JobTaskMessage task, Document document) throws IOException {
        String pages = Strings.trimToEmpty(task.getPages());
        byte[] source = blobStore.download(blobSettings.getSourceContainer(), document.getSourceBlobName());
        JsonNode result = ocrClient.analyze(source, pages);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("docId", task.getDocId());
        payload.put("jobId", task.getJobId());
        payload.put("model", ocrClient.getModelId());
        if (pages.isEmpty()) {
            payload.putNull("pages");
        } else {
            payload.put("pages", pages);
        }
        payload.put("analyzedAt", clock.instant().toString());
        payload.set("result", result);

        String blobName = resultBlobName(ownerOf(task, document), task.getDocId(), task.getJobId(), "json");
        blobStore.upload(blobSettings.getOcrContainer(), blobName, objectMapper.writeValueAsBytes(payload),
                "application/json");
        logger.info("OCR result for job {} written to {}/{}", task.getJobId(), blobSettings.getOcrContainer(), blobName);

        return blobStore.buildSignedUrl(blobSettings.getOcrContainer(), blobName, "r",
                blobSettings.getResultUrlTtlMinutes()).getUrl();
    }
}
