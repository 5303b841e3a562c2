package com.potatoregistry.upload;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.InvalidStateException;
import com.potatoregistry.error.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Aborts PENDING entries whose publish never committed (crash, lost client, exhausted retries),
 * freeing the (name, version) slot and leaving the blob to the garbage collector.
 */
@Slf4j
@Component
public class PendingReconciler {

    private final MetadataCatalog catalog;
    private final Clock clock;
    private final Duration pendingTimeout;

    @Autowired
    public PendingReconciler(MetadataCatalog catalog, Clock clock, RegistryProperties props) {
        this(catalog, clock, props.reconcile().pendingTimeout());
    }

    public PendingReconciler(MetadataCatalog catalog, Clock clock, Duration pendingTimeout) {
        this.catalog = catalog;
        this.clock = clock;
        this.pendingTimeout = pendingTimeout;
    }

    /** @return number of entries aborted */
    public int reconcile() {
        Instant cutoff = clock.instant().minus(pendingTimeout);
        int aborted = 0;
        for (CatalogEntry e : catalog.findStalePending(cutoff)) {
            try {
                catalog.abortPublish(e.id());
                aborted++;
                log.warn("aborted stale pending entry {} for {} {} (reserved {})", e.id(), e.name(), e.version(), e.stateChangedAt());
            } catch (InvalidStateException | NotFoundException settled) {
                log.debug("entry {} settled while reconciling: {}", e.id(), settled.getMessage());
            }
        }
        return aborted;
    }
}
