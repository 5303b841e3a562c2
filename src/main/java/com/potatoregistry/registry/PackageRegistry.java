package com.potatoregistry.registry;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.retrieval.FetchedArtifact;
import com.potatoregistry.retrieval.RetrievalResolver;
import com.potatoregistry.upload.PublishResult;
import com.potatoregistry.upload.UploadCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;

@Service
@RequiredArgsConstructor
public class PackageRegistry {

    private final UploadCoordinator uploads;
    private final RetrievalResolver retrieval;
    private final MetadataCatalog catalog;

    public PublishResult publish(String name, String version, InputStream body, String declaredHash, long declaredSize) {
        return uploads.publish(name, version, body, declaredHash, declaredSize);
    }

    /** The caller must close the returned artifact. */
    public FetchedArtifact fetch(String name, String versionOrRange) {
        return retrieval.fetch(name, versionOrRange);
    }

    public void delete(String name, String version) {
        delete(name, version, null);
    }

    /** Soft delete. The blob stays until no entry references it and the collector's grace period passes. */
    public void delete(String name, String version, String reason) {
        catalog.softDelete(name, version, reason);
    }

    public int deletePackage(String name, String reason) {
        return catalog.softDeletePackage(name, reason);
    }

    public List<String> listVersions(String name) {
        return catalog.listVersions(name);
    }

    public List<String> listPackages() {
        return catalog.listPackageNames();
    }

    public List<CatalogEntry> describe(String name) {
        List<CatalogEntry> entries = catalog.describe(name);
        if (entries.isEmpty()) {
            throw new NotFoundException("package " + name + " not found");
        }
        return entries;
    }
}
