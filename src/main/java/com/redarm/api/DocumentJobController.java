package com.redarm.api;

import com.redarm.security.BearerTokenAuthenticator;
import com.redarm.security.Identity;
import com.redarm.shared.dto.JobAcceptedResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/docs")
@Tag(name = "Document jobs", description = "Start export and OCR jobs for a document")
public class DocumentJobController {

    private final BearerTokenAuthenticator authenticator;
    private final JobInitiationService jobInitiationService;

    public DocumentJobController(BearerTokenAuthenticator authenticator, JobInitiationService jobInitiationService) {
        this.authenticator = authenticator;
        this.jobInitiationService = jobInitiationService;
    }

    @PostMapping("/{docId}/export")
    @Operation(summary = "Start a PDF export",
               description = "Body {\"format\":\"pdf\"} is optional. Returns the id of the queued job.")
    public ResponseEntity<JobAcceptedResponse> startExport(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Document id") @PathVariable("docId") String docId,
            @RequestBody(required = false) String body) {
        Identity identity = authenticator.authenticate(authorization);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(jobInitiationService.startExport(identity, docId, body));
    }

    @PostMapping("/{docId}/ocr")
    @Operation(summary = "Start text recognition",
               description = "Body {\"pages\":\"1-3,5\"} is optional. Returns the id of the queued job.")
    public ResponseEntity<JobAcceptedResponse> startOcr(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Document id") @PathVariable("docId") String docId,
            @RequestBody(required = false) String body) {
        Identity identity = authenticator.authenticate(authorization);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(jobInitiationService.startOcr(identity, docId, body));
    }
}
