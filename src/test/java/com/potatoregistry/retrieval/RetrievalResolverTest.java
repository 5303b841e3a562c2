package com.potatoregistry.retrieval;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.storage.BlobStore;
import com.potatoregistry.storage.HashAlgo;
import com.potatoregistry.testing.TestRegistry;
import com.potatoregistry.upload.PublishResult;
import com.potatoregistry.upload.UploadCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.potatoregistry.testing.TestRegistry.body;
import static com.potatoregistry.testing.TestRegistry.bytes;
import static com.potatoregistry.testing.TestRegistry.sha256;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class RetrievalResolverTest {

    @TempDir
    Path root;

    private TestRegistry reg;
    private UploadCoordinator uploads;
    private RetrievalResolver resolver;

    @BeforeEach
    void setUp() {
        reg = new TestRegistry(root);
        uploads = reg.coordinator();
        resolver = reg.resolver(64 * 1024);
    }

    @AfterEach
    void tearDown() {
        reg.close();
    }

    private PublishResult publish(String version, String content) {
        byte[] b = bytes(content);
        return uploads.publish("left-pad", version, body(b), sha256(b), b.length);
    }

    private static byte[] readAll(FetchedArtifact a) throws IOException {
        try (a) {
            return a.stream().readAllBytes();
        }
    }

    @Test
    void fetchReturnsPublishedBytes() throws IOException {
        PublishResult p = publish("1.0.0", "left pad v1");

        FetchedArtifact a = resolver.fetch("left-pad", "1.0.0");

        assertThat(a.version()).isEqualTo("1.0.0");
        assertThat(a.size()).isEqualTo(p.sizeBytes());
        assertThat(a.hash()).isEqualTo(p.contentHash());
        assertThat(readAll(a)).isEqualTo(bytes("left pad v1"));
    }

    @Test
    void fetchCountsDownloads() throws IOException {
        PublishResult p = publish("1.0.0", "counted");

        readAll(resolver.fetch("left-pad", "1.0.0"));
        readAll(resolver.fetch("Left_Pad", "latest"));

        assertThat(reg.catalog.findById(p.entryId())).get()
                .extracting(CatalogEntry::downloadCount).isEqualTo(2L);
    }

    @Test
    void rangesResolveToHighestMatch() throws IOException {
        publish("1.0.0", "one");
        publish("1.2.0", "one-two");
        publish("2.0.0", "two");

        assertThat(readAll(resolver.fetch("left-pad", "[1.0,2.0)"))).isEqualTo(bytes("one-two"));
        assertThat(readAll(resolver.fetch("left-pad", "latest"))).isEqualTo(bytes("two"));
        assertThat(readAll(resolver.fetch("left-pad", "<1.1"))).isEqualTo(bytes("one"));
        assertThatThrownBy(() -> resolver.fetch("left-pad", ">=3")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void pendingAndDeletedVersionsAreInvisible() throws IOException {
        publish("1.0.0", "stable");
        reg.catalog.beginPublish("left-pad", "3.0.0", 3, sha256(bytes("new")));
        publish("2.0.0", "bad");
        reg.catalog.softDelete("left-pad", "2.0.0", "broken build");

        assertThat(readAll(resolver.fetch("left-pad", "latest"))).isEqualTo(bytes("stable"));
        assertThatThrownBy(() -> resolver.fetch("left-pad", "3.0.0")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> resolver.fetch("left-pad", "2.0.0")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unknownPackageIsNotFound() {
        assertThatThrownBy(() -> resolver.fetch("right-pad", "latest")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void corruptSmallArtifactIsRefusedBeforeServing() throws IOException {
        PublishResult p = publish("1.0.0", "good bytes");
        Files.write(reg.blobPath(p.contentHash()), bytes("evil bytes"));

        assertThatThrownBy(() -> resolver.fetch("left-pad", "1.0.0"))
                .isInstanceOf(IntegrityException.class);
        assertThat(reg.catalog.findById(p.entryId())).get()
                .extracting(CatalogEntry::downloadCount).isEqualTo(0L);
    }

    @Test
    void corruptLargeArtifactFailsWhileStreaming() throws IOException {
        RetrievalResolver streamingOnly = reg.resolver(0);
        PublishResult p = publish("1.0.0", "good bytes");
        Files.write(reg.blobPath(p.contentHash()), bytes("good bytes, and more"));

        FetchedArtifact a = streamingOnly.fetch("left-pad", "1.0.0");

        assertThatThrownBy(() -> readAll(a))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("size mismatch");
    }

    @Test
    void missingBlobIsReportedAsNotFound() throws IOException {
        PublishResult p = publish("1.0.0", "gone");
        Files.delete(reg.blobPath(p.contentHash()));

        assertThatThrownBy(() -> resolver.fetch("left-pad", "1.0.0"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void blobStreamIsClosedWhenCountingFails() {
        byte[] b = bytes("left pad v1");
        PublishResult p = publish("1.0.0", "left pad v1");
        MetadataCatalog catalog = spy(reg.catalog);
        doThrow(new DataIntegrityViolationException("counter column rejected")).when(catalog).recordDownload(anyLong());
        AtomicBoolean closed = new AtomicBoolean();
        BlobStore blobs = mock(BlobStore.class);
        when(blobs.algo()).thenReturn(HashAlgo.SHA256);
        when(blobs.get(p.contentHash())).thenReturn(new ByteArrayInputStream(b) {
            @Override
            public void close() throws IOException {
                closed.set(true);
                super.close();
            }
        });
        RetrievalResolver failing = new RetrievalResolver(catalog, blobs, 0);

        assertThatThrownBy(() -> failing.fetch("left-pad", "1.0.0"))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(closed).isTrue();
    }
}
