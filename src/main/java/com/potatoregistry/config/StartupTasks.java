package com.potatoregistry.config;

import com.potatoregistry.catalog.MetadataCatalog;
import com.potatoregistry.upload.PendingReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Warms the published-version index before the web server starts, then aborts reservations
 * left behind by a previous process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupTasks implements SmartInitializingSingleton {

    private final MetadataCatalog catalog;
    private final PendingReconciler reconciler;

    @Override
    public void afterSingletonsInstantiated() {
        catalog.initializeIndex();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        int aborted = reconciler.reconcile();
        log.info("registry ready; {} stale pending entries aborted at startup", aborted);
    }
}
