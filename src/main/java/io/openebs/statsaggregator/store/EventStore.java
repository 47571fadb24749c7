package io.openebs.statsaggregator.store;

import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.EventSet;

import java.util.Optional;

/**
 * Durable copy of the counters, used to survive restarts.
 * <p>
 * Implementations assume a single active writer; {@link #apply(EventSet)} is last-write-wins.
 * Every method reports storage and decoding failures as {@link EventStoreException}.
 */
public interface EventStore {

    /**
     * @return the persisted counters, or empty if the resource does not exist
     */
    Optional<EventSet> fetch();

    /**
     * Create the resource holding {@code initial}.
     *
     * @return false if the resource already existed, in which case nothing was written
     */
    boolean createIfAbsent(EventSet initial);

    /**
     * Upsert the counters. Repeating the same call is harmless.
     */
    void apply(EventSet events);

    /**
     * Human readable location, for logs.
     */
    String describe();
}
