package com.redarm.config;

import com.redarm.util.Strings;

/**
 * Connection settings for the OCR backend. The backend counts as configured
 * only when both endpoint and key are present.
 */
public final class OcrSettings {

    private final String endpoint;
    private final String key;
    private final String modelId;
    private final String apiVersion;
    private final long pollIntervalMs;
    private final int maxPolls;

    public OcrSettings(String endpoint, String key, String modelId, String apiVersion,
                       long pollIntervalMs, int maxPolls) {
        this.endpoint = Strings.trimToEmpty(endpoint);
        this.key = Strings.trimToEmpty(key);
        this.modelId = Strings.safe(modelId, "prebuilt-read");
        this.apiVersion = Strings.safe(apiVersion, "2023-07-31");
        this.pollIntervalMs = Math.max(0, pollIntervalMs);
        this.maxPolls = Math.max(1, maxPolls);
    }

    public static OcrSettings unconfigured() {
        return new OcrSettings("", "", null, null, 0, 1);
    }

    public boolean isConfigured() {
        return !endpoint.isEmpty() && !key.isEmpty();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getKey() {
        return key;
    }

    public String getModelId() {
        return modelId;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public int getMaxPolls() {
        return maxPolls;
    }

    @Override
    public String toString() {
        // never log the key
        return "OcrSettings{endpoint=" + endpoint + ", modelId=" + modelId
                + ", apiVersion=" + apiVersion + ", configured=" + isConfigured() + "}";
    }
}
