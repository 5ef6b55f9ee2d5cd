package com.redarm.api.storage;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.HttpMethod;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URL;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Stores blobs in Google Cloud Storage. Each container maps to the bucket
 * {@code <bucket-prefix><container>}.
 * Supports both real GCS and local emulator (via STORAGE_EMULATOR_HOST).
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "gcs")
public class GcsBlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(GcsBlobStore.class);

    private final Storage storage;
    private final String bucketPrefix;
    private final Clock clock;

    @Autowired
    public GcsBlobStore(@Value("${app.storage.gcs.bucket-prefix:}") String bucketPrefix) {
        // StorageOptions picks up STORAGE_EMULATOR_HOST and Application Default Credentials
        this(StorageOptions.getDefaultInstance().getService(), bucketPrefix, Clock.systemUTC());

        String emulatorHost = System.getenv("STORAGE_EMULATOR_HOST");
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            logger.info("Using GCS emulator at: {}", emulatorHost);
        } else {
            logger.info("Using real GCS (Application Default Credentials or service account)");
        }
    }

    GcsBlobStore(Storage storage, String bucketPrefix, Clock clock) {
        this.storage = storage;
        this.bucketPrefix = bucketPrefix == null ? "" : bucketPrefix.trim();
        this.clock = clock;
        logger.info("GCS blob store initialized with bucket prefix: '{}'", this.bucketPrefix);
    }

    @Override
    public byte[] download(String container, String blobName) throws IOException {
        BlobId blobId = BlobId.of(bucket(container), blobName);
        logger.debug("Downloading blob from GCS: gs://{}/{}", blobId.getBucket(), blobName);
        try {
            return storage.readAllBytes(blobId);
        } catch (StorageException e) {
            logger.error("Failed to download blob from GCS: gs://{}/{}", blobId.getBucket(), blobName, e);
            throw new IOException("Failed to download blob: " + container + "/" + blobName, e);
        }
    }

    @Override
    public void upload(String container, String blobName, byte[] content, String contentType) throws IOException {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket(container), blobName))
                .setContentType(contentType)
                .build();
        try {
            storage.create(blobInfo, content);
            logger.info("Uploaded blob to GCS: gs://{}/{}", blobInfo.getBucket(), blobName);
        } catch (StorageException e) {
            logger.error("Failed to upload blob to GCS: gs://{}/{}", blobInfo.getBucket(), blobName, e);
            throw new IOException("Failed to upload blob: " + container + "/" + blobName, e);
        }
    }

    @Override
    public SignedUrl buildSignedUrl(String container, String blobName, String permissions, int ttlMinutes) {
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("ttlMinutes must be positive");
        }
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket(container), blobName)).build();
        Instant expiresOn = clock.instant().plusSeconds(ttlMinutes * 60L);
        URL url = storage.signUrl(blobInfo, ttlMinutes, TimeUnit.MINUTES,
                Storage.SignUrlOption.withV4Signature(),
                Storage.SignUrlOption.httpMethod(httpMethod(permissions)));
        return new SignedUrl(url.toString(), expiresOn);
    }

    String bucket(String container) {
        if (container == null || container.isBlank()) {
            throw new IllegalArgumentException("container is required");
        }
        return bucketPrefix + container;
    }

    static HttpMethod httpMethod(String permissions) {
        if ("r".equals(permissions)) {
            return HttpMethod.GET;
        }
        if ("w".equals(permissions) || "cw".equals(permissions)) {
            return HttpMethod.PUT;
        }
        throw new IllegalArgumentException("Unsupported blob permissions: " + permissions);
    }
}
