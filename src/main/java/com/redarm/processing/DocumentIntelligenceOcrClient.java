package com.redarm.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.redarm.config.OcrSettings;
import com.redarm.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Client for the Azure Document Intelligence analyze API.
 * Submits the document, then polls the Operation-Location until the
 * analysis succeeds or fails, bounded by the configured poll count.
 */
@Service
public class DocumentIntelligenceOcrClient implements OcrClient {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIntelligenceOcrClient.class);
    static final String KEY_HEADER = "Ocp-Apim-Subscription-Key";
    static final String REQUEST_FAILED = "Document Intelligence request failed";

    private final OcrSettings settings;
    private final RestClient restClient;

    public DocumentIntelligenceOcrClient(OcrSettings settings, RestClient.Builder restClientBuilder) {
        this.settings = settings;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public String getModelId() {
        return settings.getModelId();
    }

    @Override
    public JsonNode analyze(byte[] pdf, String pages) throws IOException {
        if (!settings.isConfigured()) {
            throw new IllegalStateException("Document Intelligence not configured");
        }
        URI analyzeUri = analyzeUri(pages);
        logger.info("Submitting document to Document Intelligence (model: {}, {} bytes, pages: '{}')",
                settings.getModelId(), pdf.length, Strings.trimToEmpty(pages));

        String operationLocation;
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(analyzeUri)
                    .header(KEY_HEADER, settings.getKey())
                    .contentType(MediaType.APPLICATION_PDF)
                    .body(pdf)
                    .retrieve()
                    .toBodilessEntity();
            operationLocation = response.getHeaders().getFirst("Operation-Location");
        } catch (RestClientException e) {
            logger.error("Document Intelligence analyze request failed", e);
            throw new IOException(REQUEST_FAILED, e);
        }
        if (operationLocation == null || operationLocation.isBlank()) {
            throw new IOException("Document Intelligence response missing Operation-Location");
        }
        return poll(URI.create(operationLocation));
    }

    private JsonNode poll(URI operationUri) throws IOException {
        for (int i = 0; i < settings.getMaxPolls(); i++) {
            JsonNode body;
            try {
                body = restClient.get()
                        .uri(operationUri)
                        .header(KEY_HEADER, settings.getKey())
                        .retrieve()
                        .body(JsonNode.class);
            } catch (RestClientException e) {
                logger.error("Document Intelligence poll request failed", e);
                throw new IOException(REQUEST_FAILED, e);
            }
            String status = body == null ? "" : body.path("status").asText("");
            if ("succeeded".equalsIgnoreCase(status)) {
                logger.info("Document Intelligence analysis succeeded after {} poll(s)", i + 1);
                return body.path("analyzeResult");
            }
            if ("failed".equalsIgnoreCase(status)) {
                logger.warn("Document Intelligence analysis failed: {}", body.path("error").path("message").asText(""));
                throw new IOException("Document Intelligence analysis failed");
            }
            sleep();
        }
        throw new IOException("Document Intelligence analysis timed out");
    }

    URI analyzeUri(String pages) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(stripTrailingSlash(settings.getEndpoint()))
                .path("/formrecognizer/documentModels/{model}:analyze")
                .queryParam("api-version", settings.getApiVersion());
        if (Strings.hasText(pages)) {
            builder.queryParam("pages", pages.trim());
        }
        return builder.buildAndExpand(settings.getModelId()).encode().toUri();
    }

    private void sleep() throws IOException {
        if (settings.getPollIntervalMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(settings.getPollIntervalMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for Document Intelligence", e);
        }
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
