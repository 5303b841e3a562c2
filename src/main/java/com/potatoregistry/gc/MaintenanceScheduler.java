package com.potatoregistry.gc;

import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.upload.PendingReconciler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic reconciliation and garbage collection. Ticks are skipped while a previous run of the
 * same job is still going, when the job is disabled, or once shutdown has begun.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final PendingReconciler reconciler;
    private final BlobGarbageCollector gc;
    private final RegistryProperties props;
    private final MeterRegistry registry;

    private final Counter reconcileTicks;
    private final Counter pendingAborted;
    private final Counter gcTicks;
    private final Counter blobsScanned;
    private final Counter blobsDeleted;
    private final Counter entriesPurged;
    private final Counter failures;
    private final Timer gcTimer;

    private final AtomicBoolean reconciling = new AtomicBoolean();
    private final AtomicBoolean collecting = new AtomicBoolean();
    private final AtomicInteger running = new AtomicInteger();

    private volatile boolean stopping;

    public MaintenanceScheduler(PendingReconciler reconciler, BlobGarbageCollector gc,
                                RegistryProperties props, MeterRegistry registry) {
        this.reconciler = reconciler;
        this.gc = gc;
        this.props = props;
        this.registry = registry;
        reconcileTicks = Counter.builder("registry_reconcile_ticks").description("Reconciler ticks").register(registry);
        pendingAborted = Counter.builder("registry_reconcile_aborted")
                .description("Stale pending entries aborted").register(registry);
        gcTicks = Counter.builder("registry_gc_ticks").description("Garbage collector ticks").register(registry);
        blobsScanned = Counter.builder("registry_gc_blobs_scanned").description("Blobs scanned by GC").register(registry);
        blobsDeleted = Counter.builder("registry_gc_blobs_deleted").description("Blobs deleted by GC").register(registry);
        entriesPurged = Counter.builder("registry_gc_entries_purged")
                .description("Deleted catalog entries purged after retention").register(registry);
        failures = Counter.builder("registry_maintenance_failures")
                .description("Maintenance runs that ended with an error").register(registry);
        gcTimer = Timer.builder("registry_gc_duration").description("Duration of GC runs").register(registry);
        registry.gauge("registry_maintenance_running", running);
    }

    @PreDestroy
    void onStop() {
        stopping = true;
    }

    public void reconcileTick() {
        if (stopping || !props.reconcile().enabled() || !reconciling.compareAndSet(false, true)) {
            return;
        }
        running.incrementAndGet();
        reconcileTicks.increment();
        try {
            pendingAborted.increment(reconciler.reconcile());
        } catch (RuntimeException e) {
            failures.increment();
            log.warn("reconcile tick failed; retrying next tick", e);
        } finally {
            running.decrementAndGet();
            reconciling.set(false);
        }
    }

    public void gcTick() {
        if (stopping || !props.gc().enabled() || !collecting.compareAndSet(false, true)) {
            return;
        }
        running.incrementAndGet();
        gcTicks.increment();
        Timer.Sample sample = Timer.start(registry);
        try {
            BlobGarbageCollector.Result r = gc.collect(props.gc().gracePeriod(), () -> stopping);
            blobsScanned.increment(r.blobsScanned());
            blobsDeleted.increment(r.blobsDeleted());
            entriesPurged.increment(r.entriesPurged());
        } catch (RuntimeException e) {
            failures.increment();
            log.warn("gc tick failed; retrying next tick", e);
        } finally {
            sample.stop(gcTimer);
            running.decrementAndGet();
            collecting.set(false);
        }
    }
}
