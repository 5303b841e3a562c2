package com.potatoregistry.upload;

/**
 * @param created false when the identical artifact was already published and nothing changed
 */
public record PublishResult(
        long    entryId,
        String  name,
        String  version,
        String  contentHash,
        long    sizeBytes,
        boolean created
) {}
