package com.redarm.processing;

import com.redarm.api.messaging.JobTaskMessage;
import com.redarm.api.messaging.QueueCodec;
import com.redarm.api.storage.BlobStore;
import com.redarm.config.BlobSettings;
import com.redarm.config.QueueSettings;
import com.redarm.observability.JobMetrics;
import com.redarm.observability.TracingServiceInterface;
import com.redarm.shared.model.Document;
import com.redarm.shared.model.JobType;
import com.redarm.shared.store.DocumentStore;
import com.redarm.shared.store.JobStore;
import com.redarm.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Locale;

/**
 * Exports the source PDF to the export container and returns a read-only
 * signed URL for it.
 */
@Service
public class ExportWorker extends JobWorker {

    private static final Logger logger = LoggerFactory.getLogger(ExportWorker.class);

    private final BlobStore blobStore;
    private final BlobSettings blobSettings;
    private final PdfExportRenderer renderer;

    public ExportWorker(QueueSettings queueSettings, JobStore jobStore, DocumentStore documentStore,
                        BlobStore blobStore, BlobSettings blobSettings, PdfExportRenderer renderer,
                        QueueCodec codec, JobMetrics metrics, TracingServiceInterface tracing, Clock clock) {
        super(queueSettings.getExportQueue(), JobType.EXPORT, jobStore, documentStore, codec, metrics, tracing, clock);
        this.blobStore = blobStore;
        this.blobSettings = blobSettings;
        this.renderer = renderer;
    }

    @Override
    protected String process(JobTaskMessage task, Document document) throws IOException {
        String format = Strings.safe(task.getRequestedFormat(), "pdf").trim().toLowerCase(Locale.ROOT);
        if (!"pdf".equals(format)) {
            throw new IllegalArgumentException("Only pdf export format is supported");
        }

        byte[] source = blobStore.download(blobSettings.getSourceContainer(), document.getSourceBlobName());
        byte[] exported = renderer.render(source);

        String blobName = resultBlobName(ownerOf(task, document), task.getDocId(), task.getJobId(), "pdf");
        blobStore.upload(blobSettings.getExportContainer(), blobName, exported, "application/pdf");
        logger.info("Export for job {} written to {}/{}", task.getJobId(), blobSettings.getExportContainer(), blobName);

        return blobStore.buildSignedUrl(blobSettings.getExportContainer(), blobName, "r",
                blobSettings.getResultUrlTtlMinutes()).getUrl();
    }
}
