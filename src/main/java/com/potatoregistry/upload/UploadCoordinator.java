package com.potatoregistry.upload;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.catalog.EntryState;
import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.catalog.PackageNames;
import com.potatoregistry.catalog.Reservation;
import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.error.InvalidStateException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.error.RegistryException;
import com.potatoregistry.storage.BlobStore;
import com.potatoregistry.storage.StagedBlob;
import com.potatoregistry.version.Version;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Publishes an artifact across the catalog and the blob store, which share no transaction:
 * <ol>
 *   <li>reserve (name, version) as a PENDING entry; conflicts fail before any byte hits the disk</li>
 *   <li>stream the body into a staged blob, hashing and counting as it arrives</li>
 *   <li>compare with the declared hash and size; a mismatch discards the bytes and aborts the reservation</li>
 *   <li>promote the blob under its content address</li>
 *   <li>commit the entry to PUBLISHED</li>
 * </ol>
 * A failure after step 1 that is not the client's fault leaves the PENDING entry behind;
 * {@link PendingReconciler} aborts it once it is older than the pending timeout.
 */
@Slf4j
@Service
public class UploadCoordinator {

    private final MetadataCatalog catalog;
    private final BlobStore blobs;
    private final RetryPolicy retry;
    private final long maxUploadBytes;

    @Autowired
    public UploadCoordinator(MetadataCatalog catalog, BlobStore blobs, RegistryProperties props) {
        this(catalog, blobs, RetryPolicy.from(props.upload().retry()), props.upload().maxSize().toBytes());
    }

    public UploadCoordinator(MetadataCatalog catalog, BlobStore blobs, RetryPolicy retry, long maxUploadBytes) {
        this.catalog = catalog;
        this.blobs = blobs;
        this.retry = retry;
        this.maxUploadBytes = maxUploadBytes;
    }

    // ====== Public APIs ======

    public PublishResult publish(String name, String version, InputStream body, String declaredHash, long declaredSize) {
        if (body == null) throw new IllegalArgumentException("body required");
        String n = PackageNames.normalize(name);
        requireNonBlank("version", version);
        if (!Version.isValid(version)) throw new IllegalArgumentException("invalid version: " + version);
        String hash = blobs.algo().requireHex("hash", declaredHash);
        if (declaredSize < 0) throw new IllegalArgumentException("size must be >= 0");
        if (declaredSize > maxUploadBytes)
            throw new IllegalArgumentException("size " + declaredSize + " exceeds limit of " + maxUploadBytes + " bytes");

        String label = n + " " + version;
        Reservation r = retry.call("reserve " + label, () -> catalog.beginPublish(n, version, declaredSize, hash));

        StagedBlob staged;
        try {
            staged = blobs.stage(body, declaredSize);
        } catch (RuntimeException e) {
            // oversized body, client disconnect or disk failure: nothing was promoted
            abandon(r, label, e);
            throw e;
        }

        try {
            try {
                verify(staged, hash, declaredSize, label);
            } catch (IntegrityException e) {
                abandon(r, label, e);
                throw e;
            }

            retry.call("promote " + label, () -> blobs.promote(staged));

            if (r.state() == EntryState.PUBLISHED) {
                log.info("{} already published with identical content (entry {})", label, r.entryId());
                return result(r.entryId(), n, version, staged, false);
            }
            CatalogEntry entry = commit(r, hash, label);
            log.info("published {} ({} bytes, {}) as entry {}", label, entry.sizeBytes(), hash, entry.id());
            return result(entry.id(), n, version, staged, r.created());
        } finally {
            release(staged);
        }
    }

    // ====== Helpers ======

    private static void verify(StagedBlob staged, String hash, long declaredSize, String label) {
        if (staged.sizeBytes() != declaredSize)
            throw new IntegrityException("size mismatch for " + label + ": declared=" + declaredSize + " actual=" + staged.sizeBytes());
        if (!staged.contentHash().equalsIgnoreCase(hash))
            throw new IntegrityException("hash mismatch for " + label + ": declared=" + hash + ", actual=" + staged.contentHash());
    }

    private CatalogEntry commit(Reservation r, String hash, String label) {
        try {
            return retry.call("commit " + label, () -> catalog.commitPublish(r.entryId()));
        } catch (InvalidStateException e) {
            // an identical concurrent publish of the same slot may have committed first
            CatalogEntry current = catalog.findById(r.entryId()).orElseThrow(() -> e);
            if (current.state() == EntryState.PUBLISHED && current.contentHash().equalsIgnoreCase(hash)) {
                return current;
            }
            throw e;
        } catch (NotFoundException e) {
            throw new InvalidStateException("reservation for " + label + " expired before commit; upload again");
        }
    }

    /** Compensating action: drops a reservation this request created. Joined reservations belong to someone else. */
    private void abandon(Reservation r, String label, RuntimeException cause) {
        if (!r.created()) return;
        try {
            catalog.abortPublish(r.entryId());
            log.info("aborted publish of {} (entry {}): {}", label, r.entryId(), cause.getMessage());
        } catch (RegistryException abortFailure) {
            log.warn("could not abort entry {} for {}; left for reconciliation: {}", r.entryId(), label, abortFailure.getMessage());
            cause.addSuppressed(abortFailure);
        }
    }

    private static void release(StagedBlob staged) {
        try {
            staged.close();
        } catch (IOException e) {
            log.warn("could not remove staged file for {}; the staging sweep will: {}", staged.contentHash(), e.getMessage());
        }
    }

    private static PublishResult result(long entryId, String name, String version, StagedBlob staged, boolean created) {
        return new PublishResult(entryId, name, version, staged.contentHash(), staged.sizeBytes(), created);
    }

    private static void requireNonBlank(String field, String v) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(field + " required");
    }
}
