package com.potatoregistry.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Bytes written to the staging area, hashed, but not yet visible under their content address.
 * Closing a blob that was never promoted deletes the staged file.
 */
@Slf4j
public final class StagedBlob implements Closeable {

    private final Path tempFile;
    private final String contentHash;
    private final long sizeBytes;
    private volatile boolean released;

    StagedBlob(Path tempFile, String contentHash, long sizeBytes) {
        this.tempFile = tempFile;
        this.contentHash = contentHash;
        this.sizeBytes = sizeBytes;
    }

    public String contentHash() { return contentHash; }

    public long sizeBytes() { return sizeBytes; }

    Path tempFile() { return tempFile; }

    boolean released() { return released; }

    // the store now owns the temp file
    void markReleased() { released = true; }

    @Override
    public void close() throws IOException {
        if (released) return;
        released = true;
        if (Files.deleteIfExists(tempFile)) {
            log.debug("discarded staged blob {} ({})", tempFile.getFileName(), contentHash);
        }
    }
}
