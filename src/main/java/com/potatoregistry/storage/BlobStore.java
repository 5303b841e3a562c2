package com.potatoregistry.storage;

import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.error.TransientStorageException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Content-addressed blob persistence. Blobs are keyed by the hex digest of their bytes,
 * written through a staging area and made visible only by an atomic move.
 *
 * <p>Every method reports I/O failures as {@link TransientStorageException}.
 */
public interface BlobStore {

    HashAlgo algo();

    default BlobRecord put(InputStream in) {
        try (StagedBlob staged = stage(in, Long.MAX_VALUE)) {
            return promote(staged);
        } catch (IOException e) {
            throw new TransientStorageException("failed to release staged blob", e);
        }
    }

    /**
     * Copies {@code in} into a staging file while hashing it.
     * Fails with {@link IntegrityException} as soon as more than {@code maxBytes} arrive.
     */
    StagedBlob stage(InputStream in, long maxBytes);

    BlobRecord promote(StagedBlob staged);

    /**
     * Opens the blob for reading. The stream re-hashes what it returns and fails at end of stream
     * with {@link IntegrityException} when the content no longer matches its address.
     *
     * @throws NotFoundException if no blob exists for the hash
     */
    InputStream get(String contentHash);

    Optional<BlobInfo> stat(String contentHash);

    boolean delete(String contentHash);

    /**
     * Deletes the blob only if {@code condition} holds for its current attributes. The check and the
     * deletion are atomic with respect to {@link #promote} of the same hash, so a blob that a publish
     * is about to re-reference either survives or is re-created by that publish.
     */
    boolean deleteIf(String contentHash, Predicate<BlobInfo> condition);

    // holds directory handles; close it
    Stream<BlobInfo> list();

    int purgeStaging(Instant olderThan);
}
