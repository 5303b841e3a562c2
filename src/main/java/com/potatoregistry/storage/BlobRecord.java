package com.potatoregistry.storage;

import java.nio.file.Path;

public record BlobRecord(
        String contentHash,   // HEX, lower case
        long   sizeBytes,
        Path   storagePath    // final content-addressed location
) {}
