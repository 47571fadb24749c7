package io.openebs.statsaggregator.store;

import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.EventSet;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event store keeping the counters in memory, with scriptable failures.
 */
public class InMemoryEventStore implements EventStore {

    private volatile EventSet stored;
    private volatile EventSet pendingWinner;
    private final List<EventSet> applied = new CopyOnWriteArrayList<>();

    private final AtomicInteger fetchFailures = new AtomicInteger();
    private final AtomicInteger applyFailures = new AtomicInteger();
    private final AtomicInteger createRaces = new AtomicInteger();
    private final AtomicInteger fetchCalls = new AtomicInteger();

    public InMemoryEventStore() {
    }

    public InMemoryEventStore(EventSet stored) {
        this.stored = stored.copy();
    }

    public InMemoryEventStore failNextFetches(int count) {
        fetchFailures.set(count);
        return this;
    }

    public InMemoryEventStore failNextApplies(int count) {
        applyFailures.set(count);
        return this;
    }

    /**
     * The next create attempts report "already exists", as if another bootstrap won the race
     * and stored {@code winner}.
     */
    public InMemoryEventStore loseNextCreates(int count, EventSet winner) {
        createRaces.set(count);
        this.pendingWinner = winner.copy();
        return this;
    }


    @Override
    public Optional<EventSet> fetch() {
        fetchCalls.incrementAndGet();
        if (fetchFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new EventStoreException("simulated fetch failure");
        }
        return Optional.ofNullable(stored).map(EventSet::copy);
    }

    @Override
    public boolean createIfAbsent(EventSet initial) {
        if (createRaces.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            stored = pendingWinner;
            return false;
        }
        if (stored != null) {
            return false;
        }
        stored = initial.copy();
        return true;
    }

    @Override
    public void apply(EventSet events) {
        if (applyFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new EventStoreException("simulated apply failure");
        }
        stored = events.copy();
        applied.add(events.copy());
    }

    @Override
    public String describe() {
        return "in-memory store";
    }

    public Optional<EventSet> stored() {
        return Optional.ofNullable(stored);
    }

    public List<EventSet> applied() {
        return applied;
    }

    public int fetchCalls() {
        return fetchCalls.get();
    }
}
