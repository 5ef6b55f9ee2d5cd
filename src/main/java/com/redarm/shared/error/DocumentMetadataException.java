package com.redarm.shared.error;

/**
 * Raised by a worker when the document behind a job cannot be located.
 * The job is marked failed with this message.
 */
public class DocumentMetadataException extends RuntimeException {

    public static final String MISSING_SOURCE_BLOB = "Document metadata missing source blob reference";

    public DocumentMetadataException(String message) {
        super(message);
    }

    public static DocumentMetadataException missingSourceBlob() {
        return new DocumentMetadataException(MISSING_SOURCE_BLOB);
    }
}
