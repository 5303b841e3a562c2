package com.potatoregistry.catalog;

import java.time.Instant;

public record CatalogEntry(
        long       id,
        String     name,            // normalized
        String     version,         // verbatim
        String     contentHash,     // HEX of the blob store's algorithm
        long       sizeBytes,
        EntryState state,
        Instant    uploadedAt,
        Instant    stateChangedAt,
        String     deletedReason,   // null unless DELETED
        long       downloadCount
) {}
