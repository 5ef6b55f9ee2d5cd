package com.redarm.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.redarm.config.OcrSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DocumentIntelligenceOcrClientTest {

    private static final String ENDPOINT = "https://ocr.example.com";
    private static final String OPERATION = ENDPOINT + "/formrecognizer/documentModels/prebuilt-read/analyzeResults/op-1";

    private MockRestServiceServer server;
    private DocumentIntelligenceOcrClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new DocumentIntelligenceOcrClient(
                new OcrSettings(ENDPOINT + "/", "secret-key", "prebuilt-read", "2023-07-31", 0, 3), builder);
    }

    private void expectSubmit(String expectedUri) {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Operation-Location", OPERATION);
        server.expect(requestTo(expectedUri))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Ocp-Apim-Subscription-Key", "secret-key"))
                .andExpect(header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_PDF_VALUE))
                .andRespond(withStatus(HttpStatus.ACCEPTED).headers(headers));
    }

    @Test
    void pollsUntilSucceededAndReturnsAnalyzeResult() throws IOException {
        // Given
        expectSubmit(ENDPOINT + "/formrecognizer/documentModels/prebuilt-read:analyze?api-version=2023-07-31&pages=1-2");
        server.expect(requestTo(OPERATION))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"running\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(OPERATION))
                .andRespond(withSuccess("{\"status\":\"succeeded\",\"analyzeResult\":{\"content\":\"Hello\"}}",
                        MediaType.APPLICATION_JSON));

        // When
        JsonNode result = client.analyze(new byte[]{1, 2, 3}, "1-2");

        // Then
        assertThat(result.path("content").asText()).isEqualTo("Hello");
        server.verify();
    }

    @Test
    void failedAnalysisRaisesIOException() {
        expectSubmit(ENDPOINT + "/formrecognizer/documentModels/prebuilt-read:analyze?api-version=2023-07-31");
        server.expect(requestTo(OPERATION))
                .andRespond(withSuccess("{\"status\":\"failed\",\"error\":{\"message\":\"bad pdf\"}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, ""))
                .isInstanceOf(IOException.class)
                .hasMessage("Document Intelligence analysis failed");
    }

    @Test
    void pollingStopsAfterMaxPolls() {
        expectSubmit(ENDPOINT + "/formrecognizer/documentModels/prebuilt-read:analyze?api-version=2023-07-31");
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(OPERATION))
                    .andRespond(withSuccess("{\"status\":\"running\"}", MediaType.APPLICATION_JSON));
        }

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, null))
                .isInstanceOf(IOException.class)
                .hasMessage("Document Intelligence analysis timed out");
        server.verify();
    }

    @Test
    void serverErrorDoesNotLeakDetails() {
        server.expect(requestTo(ENDPOINT + "/formrecognizer/documentModels/prebuilt-read:analyze?api-version=2023-07-31"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, ""))
                .isInstanceOf(IOException.class)
                .hasMessage("Document Intelligence request failed");
    }

    @Test
    void configurationFollowsSettings() {
        assertThat(client.isConfigured()).isTrue();
        assertThat(client.getModelId()).isEqualTo("prebuilt-read");

        DocumentIntelligenceOcrClient unconfigured =
                new DocumentIntelligenceOcrClient(OcrSettings.unconfigured(), RestClient.builder());
        assertThat(unconfigured.isConfigured()).isFalse();
    }
}
