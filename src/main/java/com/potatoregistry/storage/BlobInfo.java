package com.potatoregistry.storage;

import java.time.Instant;

public record BlobInfo(
        String  contentHash,
        long    sizeBytes,
        Instant lastModified
) {}
