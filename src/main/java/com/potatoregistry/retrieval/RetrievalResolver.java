package com.potatoregistry.retrieval;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.error.TransientStorageException;
import com.potatoregistry.storage.BlobStore;
import com.potatoregistry.storage.VerifyingInputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Resolves a name and version (or range) to a published entry and opens its blob.
 *
 * <p>The returned stream checks size and digest against the catalog entry, so corruption fails the
 * transfer instead of completing it. Artifacts up to {@code verifyBeforeServeMaxBytes} are also
 * re-hashed in full before the stream is handed out, which reports corruption before any byte is sent.
 */
@Slf4j
@Service
public class RetrievalResolver {

    private final MetadataCatalog catalog;
    private final BlobStore blobs;
    private final long verifyBeforeServeMaxBytes;

    @Autowired
    public RetrievalResolver(MetadataCatalog catalog, BlobStore blobs, RegistryProperties props) {
        this(catalog, blobs, props.retrieval().verifyBeforeServeMaxSize().toBytes());
    }

    public RetrievalResolver(MetadataCatalog catalog, BlobStore blobs, long verifyBeforeServeMaxBytes) {
        this.catalog = catalog;
        this.blobs = blobs;
        this.verifyBeforeServeMaxBytes = verifyBeforeServeMaxBytes;
    }

    public FetchedArtifact fetch(String name, String versionOrRange) {
        CatalogEntry e = catalog.resolve(name, versionOrRange);
        if (e.sizeBytes() <= verifyBeforeServeMaxBytes) {
            preVerify(e);
        }
        InputStream stream = verifying(open(e), e);
        try {
            countDownload(e);
        } catch (RuntimeException failure) {
            try {
                stream.close();
            } catch (IOException io) {
                failure.addSuppressed(io);
            }
            throw failure;
        }
        return new FetchedArtifact(e, stream);
    }

    private void preVerify(CatalogEntry e) {
        try (InputStream in = verifying(open(e), e)) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IntegrityException corrupt) {
            log.error("integrity check failed for {} {} (blob {}): {}", e.name(), e.version(), e.contentHash(), corrupt.getMessage());
            throw corrupt;
        } catch (IOException io) {
            throw new TransientStorageException("failed to read blob " + e.contentHash(), io);
        }
    }

    private InputStream open(CatalogEntry e) {
        try {
            return blobs.get(e.contentHash());
        } catch (NotFoundException missing) {
            log.error("published entry {} ({} {}) references missing blob {}", e.id(), e.name(), e.version(), e.contentHash());
            throw new NotFoundException("content of " + e.name() + " " + e.version() + " is missing");
        }
    }

    private InputStream verifying(InputStream in, CatalogEntry e) {
        return new VerifyingInputStream(in, blobs.algo(), e.contentHash(), e.sizeBytes(), e.name() + " " + e.version());
    }

    private void countDownload(CatalogEntry e) {
        try {
            catalog.recordDownload(e.id());
        } catch (TransientStorageException counterFailure) {
            log.warn("download of {} {} not counted: {}", e.name(), e.version(), counterFailure.getMessage());
        }
    }
}
