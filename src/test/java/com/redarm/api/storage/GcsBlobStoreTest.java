package com.redarm.api.storage;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.HttpMethod;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URL;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GcsBlobStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private Storage storage;

    private GcsBlobStore store;

    @BeforeEach
    void setUp() {
        store = new GcsBlobStore(storage, "redarm-", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void containersMapToPrefixedBuckets() throws IOException {
        when(storage.readAllBytes(BlobId.of("redarm-pdf-source", "a/b.pdf"))).thenReturn(new byte[]{7});

        assertThat(store.download("pdf-source", "a/b.pdf")).containsExactly(7);
    }

    @Test
    void uploadSetsContentType() throws IOException {
        store.upload("pdf-export", "a/b.pdf", new byte[]{1, 2}, "application/pdf");

        ArgumentCaptor<BlobInfo> info = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(info.capture(), eq(new byte[]{1, 2}));
        assertThat(info.getValue().getBucket()).isEqualTo("redarm-pdf-export");
        assertThat(info.getValue().getName()).isEqualTo("a/b.pdf");
        assertThat(info.getValue().getContentType()).isEqualTo("application/pdf");
    }

    @Test
    void storageErrorsBecomeIOException() {
        when(storage.readAllBytes(any(BlobId.class))).thenThrow(new StorageException(404, "No such object"));

        assertThatThrownBy(() -> store.download("pdf-source", "missing.pdf"))
                .isInstanceOf(IOException.class)
                .hasMessage("Failed to download blob: pdf-source/missing.pdf");
    }

    @Test
    void readUrlIsV4SignedGet() throws Exception {
        when(storage.signUrl(any(BlobInfo.class), eq(1440L), eq(TimeUnit.MINUTES), any(Storage.SignUrlOption[].class)))
                .thenReturn(new URL("https://storage.googleapis.com/redarm-pdf-export/a/b.pdf?X-Goog-Signature=abc"));

        SignedUrl signed = store.buildSignedUrl("pdf-export", "a/b.pdf", "r", 1440);

        assertThat(signed.getUrl()).startsWith("https://storage.googleapis.com/redarm-pdf-export/a/b.pdf");
        assertThat(signed.getExpiresOn()).isEqualTo(NOW.plusSeconds(86400));
    }

    @Test
    void permissionsMapToHttpMethods() {
        assertThat(GcsBlobStore.httpMethod("r")).isEqualTo(HttpMethod.GET);
        assertThat(GcsBlobStore.httpMethod("cw")).isEqualTo(HttpMethod.PUT);
        assertThatThrownBy(() -> GcsBlobStore.httpMethod("rwd")).isInstanceOf(IllegalArgumentException.class);
    }
}
