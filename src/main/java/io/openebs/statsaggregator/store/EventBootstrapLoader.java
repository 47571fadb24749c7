package io.openebs.statsaggregator.store;

import io.openebs.statsaggregator.exception.BootstrapException;
import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.EventSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.util.Optional;

/**
 * Loads the persisted counters at start-up, creating a zeroed resource when none exists.
 * <p>
 * Storage failures are retried according to the given {@link BackOff}. When it gives up,
 * a {@link BootstrapException} is raised: without the persisted counters there is no safe
 * starting point, since starting at zero would silently under-report a previous run.
 */
@Slf4j
public class EventBootstrapLoader {

    private final EventStore store;
    private final BackOff backOff;

    public EventBootstrapLoader(EventStore store, BackOff backOff) {
        this.store = store;
        this.backOff = backOff;
    }

    public EventSet load() {
        log.info("Loading persisted event stats from {}", store.describe());
        BackOffExecution execution = backOff.start();
        int attempt = 0;
        RuntimeException lastFailure = null;

        while (true) {
            attempt++;
            try {
                Optional<EventSet> existing = store.fetch();
                if (existing.isPresent()) {
                    log.info("Loaded {} from {}", existing.get(), store.describe());
                    return existing.get();
                }
                EventSet initial = EventSet.zero();
                if (store.createIfAbsent(initial)) {
                    log.info("No persisted event stats found, created {} with zero counters", store.describe());
                    return initial;
                }
                // lost a create race, read what the other writer stored
                lastFailure = new EventStoreException(store.describe() + " was created concurrently");
            } catch (EventStoreException e) {
                lastFailure = e;
            }

            long waitMs = execution.nextBackOff();
            if (waitMs == BackOffExecution.STOP) {
                throw new BootstrapException(
                        "Could not load or create " + store.describe() + " after " + attempt + " attempts",
                        lastFailure);
            }
            log.warn("Bootstrap attempt {} against {} failed, retrying in {}ms: {}",
                    attempt, store.describe(), waitMs, lastFailure.getMessage());
            sleep(waitMs);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BootstrapException("Interrupted while waiting to retry bootstrap", e);
        }
    }
}
