package com.redarm.api.storage;

import java.io.IOException;

/**
 * Interface for blob operations (local filesystem or GCS).
 * Blobs are addressed by container and a slash-separated blob name.
 */
public interface BlobStore {

    /**
     * Downloads a blob into memory.
     *
     * @throws IOException if the blob is missing or cannot be read
     */
    byte[] download(String container, String blobName) throws IOException;

    /**
     * Uploads (or overwrites) a blob.
     *
     * @throws IOException if the upload fails
     */
    void upload(String container, String blobName, byte[] content, String contentType) throws IOException;

    /**
     * Builds a signed URL for a blob.
     *
     * @param permissions "r" for read; "w" or "cw" for write
     * @param ttlMinutes  lifetime of the URL
     */
    SignedUrl buildSignedUrl(String container, String blobName, String permissions, int ttlMinutes);
}
