package com.potatoregistry.gc;

import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.storage.BlobInfo;
import com.potatoregistry.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Mark and sweep over the blob store.
 *
 * <p>A blob is removed only when no catalog entry references its hash (whatever the entry state)
 * and it was last modified before {@code now - grace}. The reference check is repeated under the
 * blob store's per-hash lock, so a publish that reserved the hash after the mark phase keeps it.
 */
@Slf4j
@Component
public class BlobGarbageCollector {

    public record Result(int entriesPurged, long blobsScanned, long referenced, long blobsDeleted,
                         long tooYoung, int stagingPurged) {}

    private final MetadataCatalog catalog;
    private final BlobStore blobs;
    private final Clock clock;
    private final Duration gracePeriod;
    private final Duration deletedRetention;
    private final Duration stagingMaxAge;

    @Autowired
    public BlobGarbageCollector(MetadataCatalog catalog, BlobStore blobs, Clock clock, RegistryProperties props) {
        this(catalog, blobs, clock, props.gc().gracePeriod(), props.gc().deletedRetention(),
                props.reconcile().pendingTimeout());
    }

    /** @param stagingMaxAge staging files younger than this may belong to a running upload */
    public BlobGarbageCollector(MetadataCatalog catalog, BlobStore blobs, Clock clock,
                                Duration gracePeriod, Duration deletedRetention, Duration stagingMaxAge) {
        this.catalog = catalog;
        this.blobs = blobs;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
        this.deletedRetention = deletedRetention;
        this.stagingMaxAge = stagingMaxAge;
    }

    public Result collect() {
        return collect(gracePeriod, () -> false);
    }

    public Result collect(Duration grace) {
        return collect(grace, () -> false);
    }

    /** @param stop polled between blobs; a sweep cut short is picked up by the next run */
    public Result collect(Duration grace, BooleanSupplier stop) {
        if (grace.isNegative()) throw new IllegalArgumentException("grace period must be >= 0");
        Instant now = clock.instant();
        Instant cutoff = now.minus(grace);

        int purged = catalog.purgeDeleted(now.minus(deletedRetention));
        Set<String> marked = catalog.listReferencedHashes();

        long scanned = 0, referenced = 0, deleted = 0, young = 0;
        try (Stream<BlobInfo> all = blobs.list()) {
            Iterator<BlobInfo> it = all.iterator();
            while (it.hasNext() && !stop.getAsBoolean()) {
                BlobInfo blob = it.next();
                scanned++;
                if (marked.contains(blob.contentHash())) {
                    referenced++;
                } else if (blob.lastModified().isAfter(cutoff)) {
                    young++;
                } else if (blobs.deleteIf(blob.contentHash(),
                        current -> !current.lastModified().isAfter(cutoff) && !catalog.isReferenced(current.contentHash()))) {
                    deleted++;
                    log.debug("deleted unreferenced blob {} ({} bytes)", blob.contentHash(), blob.sizeBytes());
                } else {
                    // re-referenced or touched since the mark phase
                    referenced++;
                }
            }
        }

        int staging = blobs.purgeStaging(now.minus(stagingMaxAge));
        Result r = new Result(purged, scanned, referenced, deleted, young, staging);
        log.info("gc done: purgedEntries={} scanned={} referenced={} deleted={} tooYoung={} stagingPurged={}",
                purged, scanned, referenced, deleted, young, staging);
        return r;
    }
}
