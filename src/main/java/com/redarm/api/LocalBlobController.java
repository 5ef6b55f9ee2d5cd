package com.redarm.api;

import com.redarm.api.storage.LocalBlobStore;
import com.redarm.shared.error.AuthException;
import com.redarm.shared.error.NotFoundException;
import io.swagger.v3.oas.annotations.Hidden;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Serves blobs from the local blob store behind signed URLs.
 */
@RestController
@RequestMapping("/local-blobs")
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
@Hidden
public class LocalBlobController {

    private static final Logger logger = LoggerFactory.getLogger(LocalBlobController.class);

    private final LocalBlobStore blobStore;

    public LocalBlobController(LocalBlobStore blobStore) {
        this.blobStore = blobStore;
    }

    @GetMapping("/{container}/{*blobPath}")
    public ResponseEntity<byte[]> download(
            @PathVariable("container") String container,
            @PathVariable("blobPath") String blobPath,
            @RequestParam(value = "sp", required = false) String permissions,
            @RequestParam(value = "expires", defaultValue = "0") long expires,
            @RequestParam(value = "sig", required = false) String signature) {
        String blobName = blobPath.startsWith("/") ? blobPath.substring(1) : blobPath;
        if (!blobStore.verifyReadAccess(container, blobName, permissions, expires, signature)) {
            throw AuthException.forbidden("Invalid or expired signature");
        }
        try {
            byte[] content = blobStore.download(container, blobName);
            return ResponseEntity.ok().contentType(contentTypeFor(blobName)).body(content);
        } catch (IOException e) {
            logger.warn("Signed blob {}/{} could not be read: {}", container, blobName, e.getMessage());
            throw new NotFoundException("Blob not found");
        }
    }

    static MediaType contentTypeFor(String blobName) {
        if (blobName.endsWith(".pdf")) {
            return MediaType.APPLICATION_PDF;
        }
        if (blobName.endsWith(".json")) {
            return MediaType.APPLICATION_JSON;
        }
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
