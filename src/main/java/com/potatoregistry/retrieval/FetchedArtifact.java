package com.potatoregistry.retrieval;

import com.potatoregistry.catalog.CatalogEntry;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * A resolved artifact and an open, verifying stream over its bytes. The caller owns the stream.
 */
public record FetchedArtifact(CatalogEntry entry, InputStream stream) implements Closeable {

    public String name() { return entry.name(); }

    public String version() { return entry.version(); }

    public long size() { return entry.sizeBytes(); }

    public String hash() { return entry.contentHash(); }

    @Override
    public void close() throws IOException { stream.close(); }
}
