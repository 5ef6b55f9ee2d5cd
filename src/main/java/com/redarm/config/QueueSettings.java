package com.redarm.config;

import com.redarm.util.NonNulls;

/**
 * Names of the type-specific work queues.
 */
public final class QueueSettings {

    private final String exportQueue;
    private final String ocrQueue;

    public QueueSettings(String exportQueue, String ocrQueue) {
        this.exportQueue = NonNulls.requireNonBlank(exportQueue, "export queue name is required");
        this.ocrQueue = NonNulls.requireNonBlank(ocrQueue, "ocr queue name is required");
    }

    public String getExportQueue() {
        return exportQueue;
    }

    public String getOcrQueue() {
        return ocrQueue;
    }
}
