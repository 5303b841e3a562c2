package com.potatoregistry.gc;

import com.potatoregistry.catalog.JdbcMetadataCatalog;
import com.potatoregistry.catalog.Reservation;
import com.potatoregistry.storage.BlobRecord;
import com.potatoregistry.testing.TestRegistry;
import com.potatoregistry.upload.UploadCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Set;

import static com.potatoregistry.testing.TestRegistry.body;
import static com.potatoregistry.testing.TestRegistry.bytes;
import static com.potatoregistry.testing.TestRegistry.sha256;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class BlobGarbageCollectorTest {

    private static final byte[] KEEP = bytes("referenced");
    private static final byte[] ORPHAN = bytes("orphan");

    @TempDir
    Path root;

    private TestRegistry reg;
    private UploadCoordinator uploads;
    private BlobGarbageCollector gc;

    @BeforeEach
    void setUp() {
        reg = new TestRegistry(root);
        uploads = reg.coordinator();
        gc = reg.collector(reg.catalog);
    }

    @AfterEach
    void tearDown() {
        reg.close();
    }

    private void publish(String version, byte[] content) {
        uploads.publish("left-pad", version, body(content), sha256(content), content.length);
    }

    @Test
    void keepsPublishedBlobsEvenWithZeroGrace() {
        publish("1.0.0", KEEP);

        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO);

        assertThat(r.blobsScanned()).isEqualTo(1);
        assertThat(r.referenced()).isEqualTo(1);
        assertThat(r.blobsDeleted()).isZero();
        assertThat(reg.blobs.stat(sha256(KEEP))).isPresent();
    }

    @Test
    void deletesOrphanOnlyAfterGracePeriod() {
        BlobRecord orphan = reg.blobs.put(body(ORPHAN));

        BlobGarbageCollector.Result early = gc.collect();
        assertThat(early.tooYoung()).isEqualTo(1);
        assertThat(reg.blobs.stat(orphan.contentHash())).isPresent();

        reg.clock.advance(Duration.ofHours(2));
        BlobGarbageCollector.Result late = gc.collect();
        assertThat(late.blobsDeleted()).isEqualTo(1);
        assertThat(reg.blobs.stat(orphan.contentHash())).isEmpty();
    }

    @Test
    void pendingReservationProtectsItsBlob() {
        reg.catalog.beginPublish("left-pad", "1.0.0", ORPHAN.length, sha256(ORPHAN));
        reg.blobs.put(body(ORPHAN));

        assertThat(gc.collect(Duration.ZERO).blobsDeleted()).isZero();
        assertThat(reg.blobs.stat(sha256(ORPHAN))).isPresent();
    }

    @Test
    void softDeletedEntryKeepsBlobUntilPurged() {
        publish("1.0.0", KEEP);
        reg.catalog.softDelete("left-pad", "1.0.0", "yanked");

        assertThat(gc.collect(Duration.ZERO).blobsDeleted()).isZero();
        assertThat(reg.blobs.stat(sha256(KEEP))).isPresent();

        reg.clock.advance(TestRegistry.DELETED_RETENTION.plusDays(1));
        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO);

        assertThat(r.entriesPurged()).isEqualTo(1);
        assertThat(r.blobsDeleted()).isEqualTo(1);
        assertThat(reg.blobs.stat(sha256(KEEP))).isEmpty();
    }

    @Test
    void packageDeleteLeavesBlobsToCollectorAfterRetention() {
        publish("1.0.0", KEEP);
        publish("1.1.0", ORPHAN);
        reg.catalog.softDeletePackage("left-pad", "abandoned");

        assertThat(gc.collect(Duration.ZERO).blobsDeleted()).isZero();

        reg.clock.advance(TestRegistry.DELETED_RETENTION.plusDays(1));
        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO);

        assertThat(r.entriesPurged()).isEqualTo(2);
        assertThat(r.blobsDeleted()).isEqualTo(2);
        assertThat(reg.blobs.stat(sha256(KEEP))).isEmpty();
        assertThat(reg.blobs.stat(sha256(ORPHAN))).isEmpty();
    }

    @Test
    void blobSharedWithLiveVersionSurvivesDeletion() {
        publish("1.0.0", KEEP);
        publish("1.0.1", KEEP);
        reg.catalog.softDelete("left-pad", "1.0.0", null);
        reg.clock.advance(TestRegistry.DELETED_RETENTION.plusDays(1));

        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO);

        assertThat(r.entriesPurged()).isEqualTo(1);
        assertThat(r.blobsDeleted()).isZero();
        assertThat(reg.blobs.stat(sha256(KEEP))).isPresent();
    }

    @Test
    void referenceAddedAfterMarkPhaseIsHonoured() {
        // the mark snapshot misses the reservation, the per-blob check does not
        JdbcMetadataCatalog staleMark = spy(reg.catalog);
        doReturn(Set.of()).when(staleMark).listReferencedHashes();
        Reservation r = reg.catalog.beginPublish("left-pad", "1.0.0", ORPHAN.length, sha256(ORPHAN));
        reg.blobs.put(body(ORPHAN));

        BlobGarbageCollector.Result result = reg.collector(staleMark).collect(Duration.ZERO);

        assertThat(result.blobsDeleted()).isZero();
        assertThat(result.referenced()).isEqualTo(1);
        assertThat(reg.blobs.stat(sha256(ORPHAN))).isPresent();
        assertThat(reg.catalog.findById(r.entryId())).isPresent();
    }

    @Test
    void sweepsStaleStagingFiles() throws Exception {
        Path leftover = Files.createTempFile(reg.stagingDir(), "upload-", ".part");
        Files.setLastModifiedTime(leftover, FileTime.from(reg.clock.instant().minus(Duration.ofDays(1))));
        Path active = Files.createTempFile(reg.stagingDir(), "upload-", ".part");
        Files.setLastModifiedTime(active, FileTime.from(reg.clock.instant()));

        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO);

        assertThat(r.stagingPurged()).isEqualTo(1);
        assertThat(leftover).doesNotExist();
        assertThat(active).exists();
    }

    @Test
    void stopSignalEndsSweepEarly() {
        reg.blobs.put(body(ORPHAN));
        reg.blobs.put(body(bytes("another orphan")));

        BlobGarbageCollector.Result r = gc.collect(Duration.ZERO, () -> true);

        assertThat(r.blobsScanned()).isZero();
        assertThat(r.blobsDeleted()).isZero();
    }

    @Test
    void negativeGraceIsRejected() {
        assertThatThrownBy(() -> gc.collect(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
