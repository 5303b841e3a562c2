package com.potatoregistry.catalog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative record of which (name, version) maps to which blob, and in which state.
 * All names are normalized with {@link PackageNames#normalize} on the way in.
 */
public interface MetadataCatalog {

    /**
     * Reserves (name, version) for the given content.
     *
     * @return the new PENDING entry, or the existing entry when identical content already holds the slot
     * @throws com.potatoregistry.error.ConflictException if a non-deleted entry holds the slot with other content
     */
    Reservation beginPublish(String name, String version, long expectedSize, String expectedHash);

    CatalogEntry commitPublish(long entryId);

    void abortPublish(long entryId);

    /** Exact version or range expression; only PUBLISHED entries are visible. */
    CatalogEntry resolve(String name, String versionOrRange);

    CatalogEntry softDelete(String name, String version, String reason);

    /**
     * Soft-deletes every PUBLISHED version of a package at once.
     *
     * @return how many entries moved to DELETED
     * @throws com.potatoregistry.error.NotFoundException if the package has no published version
     */
    int softDeletePackage(String name, String reason);

    /** Hashes of every entry still present, whatever its state. */
    Set<String> listReferencedHashes();

    boolean isReferenced(String contentHash);

    /** Published versions, highest first. */
    List<String> listVersions(String name);

    List<String> listPackageNames();

    /** Published and deleted entries of a package, highest version first. */
    List<CatalogEntry> describe(String name);

    Optional<CatalogEntry> findById(long entryId);

    List<CatalogEntry> findStalePending(Instant olderThan);

    int purgeDeleted(Instant olderThan);

    void recordDownload(long entryId);

    void initializeIndex();
}
