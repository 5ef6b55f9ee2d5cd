package com.redarm.processing;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Text recognition backend used by the OCR worker.
 */
public interface OcrClient {

    /**
     * @return true when endpoint and credentials are present
     */
    boolean isConfigured();

    /**
     * Model id reported alongside results.
     */
    String getModelId();

    /**
     * Analyzes a PDF and returns the backend's analysis result.
     *
     * @param pdf   source document bytes
     * @param pages page selection such as "1-3,5", or empty for all pages
     * @throws IOException if the backend call fails or the analysis does not succeed
     */
    JsonNode analyze(byte[] pdf, String pages) throws IOException;
}
