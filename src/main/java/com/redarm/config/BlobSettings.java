package com.redarm.config;

import com.redarm.util.NonNulls;

/**
 * Blob containers used by the workers and the lifetime of signed result URLs.
 */
public final class BlobSettings {

    private final String sourceContainer;
    private final String exportContainer;
    private final String ocrContainer;
    private final int resultUrlTtlMinutes;

    public BlobSettings(String sourceContainer, String exportContainer, String ocrContainer, int resultUrlTtlMinutes) {
        this.sourceContainer = NonNulls.requireNonBlank(sourceContainer, "source container is required");
        this.exportContainer = NonNulls.requireNonBlank(exportContainer, "export container is required");
        this.ocrContainer = NonNulls.requireNonBlank(ocrContainer, "ocr container is required");
        if (resultUrlTtlMinutes <= 0) {
            throw new IllegalArgumentException("result URL TTL must be positive");
        }
        this.resultUrlTtlMinutes = resultUrlTtlMinutes;
    }

    public String getSourceContainer() {
        return sourceContainer;
    }

    public String getExportContainer() {
        return exportContainer;
    }

    public String getOcrContainer() {
        return ocrContainer;
    }

    public int getResultUrlTtlMinutes() {
        return resultUrlTtlMinutes;
    }
}
