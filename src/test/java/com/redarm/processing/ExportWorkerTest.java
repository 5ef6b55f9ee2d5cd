package com.redarm.processing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redarm.TestPdfFactory;
import com.redarm.api.messaging.JobTaskMessage;
import com.redarm.api.messaging.QueueCodec;
import com.redarm.api.storage.BlobStore;
import com.redarm.api.storage.SignedUrl;
import com.redarm.config.BlobSettings;
import com.redarm.config.QueueSettings;
import com.redarm.observability.JobMetrics;
import com.redarm.observability.TracingServiceStub;
import com.redarm.shared.error.DocumentMetadataException;
import com.redarm.shared.model.Document;
import com.redarm.shared.model.JobStatus;
import com.redarm.shared.model.JobUpdate;
import com.redarm.shared.store.DocumentStore;
import com.redarm.shared.store.JobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportWorkerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String JOB_ID = "0b3c0d3e-5f7a-4a2b-9c1d-2e3f4a5b6c7d";
    private static final String SIGNED = "https://blobs.example.com/pdf-export/alice@example.com/doc-1/" + JOB_ID + ".pdf?sig=x";

    @Mock
    private JobStore jobStore;

    @Mock
    private DocumentStore documentStore;

    @Mock
    private BlobStore blobStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueueCodec codec = new QueueCodec(objectMapper);
    private SimpleMeterRegistry meterRegistry;
    private ExportWorker worker;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        worker = new ExportWorker(
                new QueueSettings("q-export", "q-ocr"),
                jobStore, documentStore, blobStore,
                new BlobSettings("pdf-source", "pdf-export", "ocr-json", 1440),
                new PdfExportRenderer(clock),
                codec, new JobMetrics(meterRegistry), new TracingServiceStub(), clock);
    }

    private JobTaskMessage task() {
        return JobTaskMessage.export(JOB_ID, "doc-1", "alice@example.com", NOW.toString(), "pdf");
    }

    private void givenSourceDocument() throws IOException {
        when(documentStore.getDocument("doc-1"))
                .thenReturn(Optional.of(new Document("doc-1", "alice@example.com", "alice@example.com/doc-1/source.pdf")));
        when(blobStore.download("pdf-source", "alice@example.com/doc-1/source.pdf"))
                .thenReturn(TestPdfFactory.pdfWithPages("page one", "page two"));
    }

    @Test
    void exportCompletesWithSignedUrl() throws Exception {
        // Given
        givenSourceDocument();
        when(blobStore.buildSignedUrl(eq("pdf-export"), any(), eq("r"), eq(1440)))
                .thenReturn(new SignedUrl(SIGNED, NOW.plusSeconds(86400)));

        // When
        worker.handle(codec.encode(task()));

        // Then: running is written before any blob I/O, completed last
        InOrder order = inOrder(jobStore, blobStore);
        order.verify(jobStore).updateJob(eq(JOB_ID), argThat(update -> JobStatus.RUNNING.equals(update.getStatus())));
        order.verify(blobStore).download("pdf-source", "alice@example.com/doc-1/source.pdf");
        order.verify(blobStore).upload(eq("pdf-export"), eq("alice@example.com/doc-1/" + JOB_ID + ".pdf"),
                any(byte[].class), eq("application/pdf"));
        order.verify(jobStore).updateJob(eq(JOB_ID), argThat(update -> JobStatus.COMPLETED.equals(update.getStatus())));

        ArgumentCaptor<JobUpdate> updates = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore, times(2)).updateJob(eq(JOB_ID), updates.capture());
        List<JobUpdate> written = updates.getAllValues();
        assertThat(written.get(0).getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(written.get(0).getAttempt()).isZero();
        assertThat(written.get(1).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(written.get(1).getResultUri()).isEqualTo(SIGNED);
        assertThat(written.get(1).isErrorSet()).isTrue();
        assertThat(written.get(1).getError()).isNull();
        assertThat(meterRegistry.counter("redarm.job.completed", "service", "redarm-jobs", "type", "export").count())
                .isEqualTo(1.0);
    }

    @Test
    void uploadedExportIsAValidPdfWithSamePageCount() throws Exception {
        // Given
        givenSourceDocument();
        when(blobStore.buildSignedUrl(any(), any(), any(), anyInt()))
                .thenReturn(new SignedUrl(SIGNED, NOW.plusSeconds(86400)));

        // When
        worker.handle(task());

        // Then
        ArgumentCaptor<byte[]> uploaded = ArgumentCaptor.forClass(byte[].class);
        verify(blobStore).upload(any(), any(), uploaded.capture(), any());
        try (PDDocument exported = Loader.loadPDF(uploaded.getValue())) {
            assertThat(exported.getNumberOfPages()).isEqualTo(2);
            assertThat(exported.getDocumentInformation().getProducer()).isEqualTo(PdfExportRenderer.PRODUCER);
        }
    }

    @Test
    void redeliveryRewritesSameBlobAndCompletesAgain() throws Exception {
        // Given
        givenSourceDocument();
        when(blobStore.buildSignedUrl(any(), any(), any(), anyInt()))
                .thenReturn(new SignedUrl(SIGNED, NOW.plusSeconds(86400)));
        String message = codec.encode(task());

        // When
        worker.handle(message);
        worker.handle(message);

        // Then
        verify(blobStore, times(2)).upload(eq("pdf-export"), eq("alice@example.com/doc-1/" + JOB_ID + ".pdf"),
                any(byte[].class), eq("application/pdf"));
        ArgumentCaptor<JobUpdate> updates = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore, times(4)).updateJob(eq(JOB_ID), updates.capture());
        assertThat(updates.getAllValues()).extracting(JobUpdate::getStatus)
                .containsExactly(JobStatus.RUNNING, JobStatus.COMPLETED, JobStatus.RUNNING, JobStatus.COMPLETED);
    }

    @Test
    void missingSourceBlobFailsJobAndRethrows() {
        // Given: document exists but has no source blob reference
        when(documentStore.getDocument("doc-1"))
                .thenReturn(Optional.of(new Document("doc-1", "alice@example.com", null)));

        // When / Then
        assertThatThrownBy(() -> worker.handle(codec.encode(task())))
                .isInstanceOf(DocumentMetadataException.class)
                .hasMessage("Document metadata missing source blob reference");

        ArgumentCaptor<JobUpdate> updates = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore, times(2)).updateJob(eq(JOB_ID), updates.capture());
        JobUpdate failed = updates.getAllValues().get(1);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("Document metadata missing source blob reference");
        assertThat(failed.isResultUriSet()).isFalse();
        verifyNoInteractions(blobStore);
    }

    @Test
    void unknownDocumentFailsJobAndRethrows() {
        // Given
        when(documentStore.getDocument("doc-1")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> worker.handle(task()))
                .isInstanceOf(DocumentMetadataException.class);
        ArgumentCaptor<JobUpdate> updates = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore, times(2)).updateJob(eq(JOB_ID), updates.capture());
        assertThat(updates.getAllValues().get(1).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void blobFailureIsRethrownUnchanged() throws Exception {
        // Given
        when(documentStore.getDocument("doc-1"))
                .thenReturn(Optional.of(new Document("doc-1", "alice@example.com", "source.pdf")));
        IOException storageDown = new IOException("Failed to download blob: pdf-source/source.pdf");
        when(blobStore.download("pdf-source", "source.pdf")).thenThrow(storageDown);

        // When / Then
        assertThatThrownBy(() -> worker.handle(task())).isSameAs(storageDown);
        ArgumentCaptor<JobUpdate> updates = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore, times(2)).updateJob(eq(JOB_ID), updates.capture());
        assertThat(updates.getAllValues().get(1).getError()).isEqualTo("Failed to download blob: pdf-source/source.pdf");
        assertThat(meterRegistry.counter("redarm.job.failed", "service", "redarm-jobs", "type", "export").count())
                .isEqualTo(1.0);
    }

    @Test
    void failedWriteErrorIsAttachedToOriginalError() throws Exception {
        // Given
        when(documentStore.getDocument("doc-1"))
                .thenReturn(Optional.of(new Document("doc-1", "alice@example.com", "source.pdf")));
        IOException storageDown = new IOException("storage down");
        when(blobStore.download("pdf-source", "source.pdf")).thenThrow(storageDown);
        IllegalStateException dbDown = new IllegalStateException("db down");
        lenient().doThrow(dbDown).when(jobStore)
                .updateJob(eq(JOB_ID), argThat(update -> JobStatus.FAILED.equals(update.getStatus())));

        // When / Then
        assertThatThrownBy(() -> worker.handle(task()))
                .isSameAs(storageDown)
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(dbDown));
    }

    @Test
    void runningWriteFailureStillMarksJobFailed() throws Exception {
        // Given
        IllegalStateException dbBlip = new IllegalStateException("connection reset");
        lenient().doThrow(dbBlip).when(jobStore)
                .updateJob(eq(JOB_ID), argThat(update -> JobStatus.RUNNING.equals(update.getStatus())));

        // When / Then
        assertThatThrownBy(() -> worker.handle(task())).isSameAs(dbBlip);
        verify(jobStore).updateJob(eq(JOB_ID), argThat(update -> JobStatus.FAILED.equals(update.getStatus())
                && "connection reset".equals(update.getError())));
        verifyNoInteractions(documentStore, blobStore);
        assertThat(meterRegistry.counter("redarm.job.failed", "service", "redarm-jobs", "type", "export").count())
                .isEqualTo(1.0);
    }

    @Test
    void undecodableMessageIsDroppedWithoutJobWrite() throws Exception {
        // When
        worker.handle("definitely not a task");

        // Then
        verifyNoInteractions(jobStore, documentStore, blobStore);
        assertThat(meterRegistry.counter("redarm.queue.poison", "service", "redarm-jobs", "queue", "q-export").count())
                .isEqualTo(1.0);
    }

    @Test
    void messageWithoutIdsIsDroppedWithoutJobWrite() throws Exception {
        // Given
        JobTaskMessage noJobId = task();
        noJobId.setJobId("  ");
        JobTaskMessage noDocId = task();
        noDocId.setDocId(null);

        // When
        worker.handle(codec.encode(noJobId));
        worker.handle(noDocId);

        // Then
        verifyNoInteractions(jobStore, documentStore, blobStore);
    }

    @Test
    void ownerFallsBackToDocumentOwner() throws Exception {
        // Given
        JobTaskMessage legacy = task();
        legacy.setOwnerEmail(null);
        givenSourceDocument();
        when(blobStore.buildSignedUrl(any(), any(), any(), anyInt()))
                .thenReturn(new SignedUrl(SIGNED, NOW.plusSeconds(86400)));

        // When
        worker.handle(legacy);

        // Then
        verify(blobStore).upload(eq("pdf-export"), eq("alice@example.com/doc-1/" + JOB_ID + ".pdf"),
                any(byte[].class), eq("application/pdf"));
    }
}
