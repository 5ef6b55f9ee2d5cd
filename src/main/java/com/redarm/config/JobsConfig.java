package com.redarm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the immutable settings objects handed to handlers and workers.
 */
@Configuration
public class JobsConfig {

    private static final Logger logger = LoggerFactory.getLogger(JobsConfig.class);

    @Bean
    public QueueSettings queueSettings(
            @Value("${app.queues.export:q-export}") String exportQueue,
            @Value("${app.queues.ocr:q-ocr}") String ocrQueue) {
        logger.info("Queues: export={}, ocr={}", exportQueue, ocrQueue);
        return new QueueSettings(exportQueue, ocrQueue);
    }

    @Bean
    public BlobSettings blobSettings(
            @Value("${app.blob.source-container:pdf-source}") String sourceContainer,
            @Value("${app.blob.export-container:pdf-export}") String exportContainer,
            @Value("${app.blob.ocr-container:ocr-json}") String ocrContainer,
            @Value("${app.blob.result-url-ttl-minutes:1440}") int resultUrlTtlMinutes) {
        return new BlobSettings(sourceContainer, exportContainer, ocrContainer, resultUrlTtlMinutes);
    }

    @Bean
    public OcrSettings ocrSettings(
            @Value("${app.ocr.endpoint:}") String endpoint,
            @Value("${app.ocr.key:}") String key,
            @Value("${app.ocr.model-id:prebuilt-read}") String modelId,
            @Value("${app.ocr.api-version:2023-07-31}") String apiVersion,
            @Value("${app.ocr.poll-interval-ms:1000}") long pollIntervalMs,
            @Value("${app.ocr.max-polls:120}") int maxPolls) {
        OcrSettings settings = new OcrSettings(endpoint, key, modelId, apiVersion, pollIntervalMs, maxPolls);
        if (!settings.isConfigured()) {
            logger.warn("OCR backend is not configured; OCR jobs will fail with a configuration error");
        } else {
            logger.info("OCR backend configured: {}", settings);
        }
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
