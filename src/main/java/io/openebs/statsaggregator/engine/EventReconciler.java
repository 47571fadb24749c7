package io.openebs.statsaggregator.engine;

import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.metrics.Metrics;
import io.openebs.statsaggregator.model.EventSet;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.store.EventStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically writes a snapshot of the events cache to the event store.
 * <p>
 * The snapshot is taken before any I/O, so the cache is never locked while the store is
 * being called. A failed apply is logged and retried on the next tick; the interval bounds
 * how many increments a crash can lose.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventReconciler {

    private final EventsCache cache;
    private final EventStore store;
    private final Metrics metrics;

    @Scheduled(
            fixedDelayString = "${events.store.reconcile-interval-ms:60000}",
            initialDelayString = "${events.store.reconcile-interval-ms:60000}"
    )
    public void reconcile() {
        reconcileOnce();
    }

    /**
     * @return true if the snapshot reached the store
     */
    public boolean reconcileOnce() {
        EventSet snapshot = cache.snapshot();
        try {
            store.apply(snapshot);
        } catch (EventStoreException e) {
            metrics.onReconcileFailed();
            log.error("Failed to reconcile event stats into {}, retrying next tick", store.describe(), e);
            return false;
        } catch (RuntimeException e) {
            metrics.onReconcileFailed();
            log.error("Unexpected error reconciling event stats into {}", store.describe(), e);
            return false;
        }
        metrics.onReconcileSucceeded();
        log.debug("Reconciled {} into {}", snapshot, store.describe());
        return true;
    }

    @PreDestroy
    public void flush() {
        log.info("Flushing event stats to {} before shutdown", store.describe());
        reconcileOnce();
    }
}
