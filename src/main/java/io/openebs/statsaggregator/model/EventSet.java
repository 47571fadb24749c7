package io.openebs.statsaggregator.model;

import io.openebs.statsaggregator.exception.InvalidCounterKeyException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Full table of counters, one per valid {@link CounterKey}, every key present.
 * <p>
 * Entries read from storage that this build does not recognise are kept aside as
 * "foreign" counters. They are never incremented or exported, but they are written
 * back untouched so newer data survives an older reader.
 * <p>
 * Not thread-safe. Sharing goes through {@code EventsCache}, which hands out copies.
 */
public final class EventSet {

    /** Counters are persisted as unsigned 32-bit values and stop at this ceiling. */
    public static final long MAX_COUNTER = 0xFFFF_FFFFL;

    private final Map<CounterKey, Long> counters;
    private final Map<String, Map<String, Long>> foreign;

    private EventSet(Map<CounterKey, Long> counters, Map<String, Map<String, Long>> foreign) {
        this.counters = counters;
        this.foreign = foreign;
    }

    /**
     * All known counters at zero, no foreign entries.
     */
    public static EventSet zero() {
        Map<CounterKey, Long> counters = new LinkedHashMap<>();
        for (CounterKey key : CounterKey.all()) {
            counters.put(key, 0L);
        }
        return new EventSet(counters, new TreeMap<>());
    }

    public long get(CounterKey key) {
        return counters.get(key);
    }

    public long get(Category category, Action action) {
        return get(CounterKey.of(category, action));
    }

    /**
     * Add one to the counter for the given pair.
     *
     * @return false if the counter is already at {@link #MAX_COUNTER} and was left there
     * @throws InvalidCounterKeyException if the category does not count that action
     */
    public boolean increment(Category category, Action action) {
        return increment(CounterKey.of(category, action));
    }

    public boolean increment(CounterKey key) {
        long current = counters.get(key);
        if (current >= MAX_COUNTER) {
            return false;
        }
        counters.put(key, current + 1);
        return true;
    }

    /**
     * Overwrite a counter. Used when decoding persisted data.
     */
    public EventSet with(CounterKey key, long value) {
        if (value < 0 || value > MAX_COUNTER) {
            throw new IllegalArgumentException("Counter " + key + " is out of range: " + value);
        }
        counters.put(key, value);
        return this;
    }

    /**
     * Record an entry that does not map to a known key.
     */
    public EventSet withForeign(String category, String action, long value) {
        if (value < 0 || value > MAX_COUNTER) {
            throw new IllegalArgumentException("Counter " + category + "." + action + " is out of range: " + value);
        }
        withForeignCategory(category).put(action, value);
        return this;
    }

    /**
     * Record an unrecognised category, possibly with no actions yet.
     */
    public EventSet withForeign(String category) {
        withForeignCategory(category);
        return this;
    }

    /**
     * Read-only view of the known counters, in {@link CounterKey#all()} order.
     */
    public Map<CounterKey, Long> counters() {
        return Collections.unmodifiableMap(counters);
    }

    /**
     * Read-only view of unrecognised persisted entries, category to action to value.
     */
    public Map<String, Map<String, Long>> foreign() {
        return Collections.unmodifiableMap(foreign);
    }

    /**
     * Independent deep copy.
     */
    public EventSet copy() {
        Map<String, Map<String, Long>> foreignCopy = new TreeMap<>();
        foreign.forEach((category, actions) -> foreignCopy.put(category, new TreeMap<>(actions)));
        return new EventSet(new LinkedHashMap<>(counters), foreignCopy);
    }

    private Map<String, Long> withForeignCategory(String category) {
        return foreign.computeIfAbsent(category, c -> new TreeMap<>());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventSet other)) {
            return false;
        }
        return counters.equals(other.counters) && foreign.equals(other.foreign);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counters, foreign);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EventSet{");
        counters.forEach((key, value) -> sb.append(key).append('=').append(value).append(", "));
        if (!foreign.isEmpty()) {
            sb.append("foreign=").append(foreign).append(", ");
        }
        sb.setLength(sb.length() - 2);
        return sb.append('}').toString();
    }
}
