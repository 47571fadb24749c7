package io.openebs.statsaggregator.state;

import io.openebs.statsaggregator.exception.CacheNotInitializedException;
import io.openebs.statsaggregator.exception.InvalidCounterKeyException;
import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.model.CounterKey;
import io.openebs.statsaggregator.model.EventSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * In-memory holder of the current {@link EventSet}.
 * <p>
 * One instance per process, shared by the ingestion listener (the only writer), the
 * reconciler and the exporter. Every access runs under a single monitor and only ever
 * covers an O(1) increment or a copy, so callers never hold it across I/O.
 * <p>
 * The cache is seeded exactly once through {@link #initialize(EventSet)}; that is the
 * only point where counters are replaced wholesale.
 */
@Slf4j
public class EventsCache {

    private final Object lock = new Object();

    private EventSet events;

    /**
     * Seed the cache. A second call is ignored.
     *
     * @param initial counters loaded at bootstrap; copied, the caller keeps ownership
     * @return true if this call seeded the cache
     */
    public boolean initialize(EventSet initial) {
        EventSet seed = initial.copy();
        synchronized (lock) {
            if (events != null) {
                log.warn("Events cache already initialized, ignoring second initialization");
                return false;
            }
            events = seed;
        }
        log.info("Events cache initialized with {}", seed);
        return true;
    }

    /**
     * Count one occurrence of the given event.
     *
     * @throws InvalidCounterKeyException   if the category does not count that action;
     *                                      no counter is touched in that case
     * @throws CacheNotInitializedException if bootstrap has not seeded the cache yet
     */
    public void increment(Category category, Action action) {
        increment(CounterKey.of(category, action));
    }

    public void increment(CounterKey key) {
        boolean counted;
        synchronized (lock) {
            counted = requireInitialized().increment(key);
        }
        if (!counted) {
            log.warn("Counter {} is saturated at {}, event not counted", key, EventSet.MAX_COUNTER);
        }
    }

    /**
     * Independent copy of all counters, consistent across categories.
     *
     * @throws CacheNotInitializedException if bootstrap has not seeded the cache yet
     */
    public EventSet snapshot() {
        synchronized (lock) {
            return requireInitialized().copy();
        }
    }

    /**
     * Like {@link #snapshot()}, but empty instead of failing before initialization.
     */
    public Optional<EventSet> trySnapshot() {
        synchronized (lock) {
            return events == null ? Optional.empty() : Optional.of(events.copy());
        }
    }

    private EventSet requireInitialized() {
        if (events == null) {
            throw new CacheNotInitializedException();
        }
        return events;
    }
}
