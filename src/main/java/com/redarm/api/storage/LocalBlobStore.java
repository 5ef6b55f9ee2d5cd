package com.redarm.api.storage;

import com.redarm.security.UrlSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Stores blobs on the local filesystem, one folder per container.
 * Signed URLs point at {@code /local-blobs/{container}/{blob}} and carry an
 * HMAC over container, blob, permissions and expiry.
 * Only loads when app.storage.mode=local (or when property is missing, as it's the default).
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
public class LocalBlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalBlobStore.class);
    private static final Pattern CONTAINER_NAME = Pattern.compile("^[a-z0-9][a-z0-9-]{0,62}$");
    static final String URL_PREFIX = "/local-blobs/";

    private final Path storageRoot;
    private final String publicBaseUrl;
    private final UrlSigner urlSigner;
    private final Clock clock;

    @Autowired
    public LocalBlobStore(
            @Value("${app.storage.local-dir:.local-storage}") String localDir,
            @Value("${app.public-base-url:http://localhost:8080}") String publicBaseUrl,
            UrlSigner urlSigner) {
        this(localDir, publicBaseUrl, urlSigner, Clock.systemUTC());
    }

    LocalBlobStore(String localDir, String publicBaseUrl, UrlSigner urlSigner, Clock clock) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
        this.urlSigner = urlSigner;
        this.clock = clock;

        try {
            Files.createDirectories(storageRoot);
            logger.info("Local blob store initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local blob directory", e);
        }
    }

    @Override
    public byte[] download(String container, String blobName) throws IOException {
        Path path = resolve(container, blobName);
        try {
            byte[] content = Files.readAllBytes(path);
            logger.debug("Downloaded blob {}/{} ({} bytes)", container, blobName, content.length);
            return content;
        } catch (NoSuchFileException e) {
            throw new IOException("Blob not found: " + container + "/" + blobName);
        } catch (IOException e) {
            logger.error("Failed to read blob {}/{}", container, blobName, e);
            throw new IOException("Failed to read blob: " + container + "/" + blobName);
        }
    }

    @Override
    public void upload(String container, String blobName, byte[] content, String contentType) throws IOException {
        Path path = resolve(container, blobName);
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, content);
            logger.info("Uploaded blob {}/{} ({} bytes, {})", container, blobName, content.length, contentType);
        } catch (IOException e) {
            logger.error("Failed to write blob {}/{}", container, blobName, e);
            throw new IOException("Failed to write blob: " + container + "/" + blobName);
        }
    }

    @Override
    public SignedUrl buildSignedUrl(String container, String blobName, String permissions, int ttlMinutes) {
        resolve(container, blobName);
        if (permissions == null || permissions.isBlank()) {
            throw new IllegalArgumentException("permissions are required");
        }
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("ttlMinutes must be positive");
        }
        Instant expiresOn = clock.instant().plusSeconds(ttlMinutes * 60L);
        long expires = expiresOn.getEpochSecond();
        String signature = urlSigner.sign(canonical(container, blobName, permissions, expires));

        StringBuilder url = new StringBuilder(publicBaseUrl)
                .append(URL_PREFIX)
                .append(UriUtils.encodePathSegment(container, StandardCharsets.UTF_8));
        for (String segment : blobName.split("/")) {
            url.append('/').append(UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8));
        }
        url.append("?sp=").append(UriUtils.encodeQueryParam(permissions, StandardCharsets.UTF_8))
                .append("&expires=").append(expires)
                .append("&sig=").append(signature);
        return new SignedUrl(url.toString(), Instant.ofEpochSecond(expires));
    }

    /**
     * Checks a presented URL signature. Returns false for an expired URL, a
     * URL without read permission, or a signature mismatch.
     */
    public boolean verifyReadAccess(String container, String blobName, String permissions, long expires, String signature) {
        if (permissions == null || !permissions.contains("r")) {
            return false;
        }
        if (clock.instant().getEpochSecond() > expires) {
            return false;
        }
        return urlSigner.verify(canonical(container, blobName, permissions, expires), signature);
    }

    Path resolve(String container, String blobName) {
        if (container == null || !CONTAINER_NAME.matcher(container).matches()) {
            throw new IllegalArgumentException("Invalid container name");
        }
        if (blobName == null || blobName.isBlank() || blobName.startsWith("/") || blobName.contains("\\")) {
            throw new IllegalArgumentException("Invalid blob name");
        }
        for (String segment : blobName.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid blob name");
            }
        }
        Path containerRoot = storageRoot.resolve(container);
        Path path = containerRoot.resolve(blobName).normalize();
        // Security check: ensure the resolved path is within the container
        if (!path.startsWith(containerRoot)) {
            throw new IllegalArgumentException("Path traversal detected");
        }
        return path;
    }

    private static String canonical(String container, String blobName, String permissions, long expires) {
        return container + "/" + blobName + "\n" + permissions + "\n" + expires;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            return "http://localhost:8080";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
