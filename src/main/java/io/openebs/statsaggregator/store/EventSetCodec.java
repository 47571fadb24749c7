package io.openebs.statsaggregator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.model.CounterKey;
import io.openebs.statsaggregator.model.EventSet;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Converts between {@link EventSet} and the persisted nested-map schema
 * {@code { events: { <Category>: { <Action>: <uint32> } } }}.
 * <p>
 * Decoding starts from all-zero counters, so missing keys read as 0. Pairs this build
 * does not count are kept as foreign entries and encoded back as they were read.
 */
@Slf4j
public class EventSetCodec {

    /** Persisted counters are unsigned 32-bit. */
    public static final long MAX_COUNTER = EventSet.MAX_COUNTER;

    private final ObjectMapper objectMapper;

    public EventSetCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EventStatsSpec encode(EventSet events) {
        Map<String, Map<String, Long>> encoded = new TreeMap<>();
        events.foreign().forEach((category, actions) ->
                encoded.computeIfAbsent(category, c -> new TreeMap<>()).putAll(actions));
        events.counters().forEach((key, value) ->
                encoded.computeIfAbsent(key.category().wireName(), c -> new TreeMap<>())
                        .put(key.action().wireName(), value));
        return new EventStatsSpec(encoded);
    }

    /**
     * Names match case-insensitively. When two spellings of one known counter are both
     * present, the larger value wins and a warning is logged.
     *
     * @throws EventStoreException if a counter is missing, negative or does not fit in 32 bits
     */
    public EventSet decode(EventStatsSpec spec) {
        EventSet events = EventSet.zero();
        if (spec == null || spec.getEvents() == null) {
            return events;
        }
        Map<CounterKey, String> spellings = new HashMap<>();
        spec.getEvents().forEach((category, actions) -> {
            if (actions == null || actions.isEmpty()) {
                if (!isCanonicalCategory(category)) {
                    events.withForeign(category);
                }
                return;
            }
            actions.forEach((action, value) -> {
                long count = checkedCount(category, action, value);
                Optional<CounterKey> key = resolve(category, action);
                if (key.isEmpty()) {
                    log.debug("Keeping unrecognised persisted counter {}.{}={}", category, action, count);
                    events.withForeign(category, action, count);
                    return;
                }
                String spelling = category + "." + action;
                String previous = spellings.putIfAbsent(key.get(), spelling);
                if (previous == null) {
                    events.with(key.get(), count);
                    return;
                }
                long kept = Math.max(events.get(key.get()), count);
                log.warn("Persisted counters {} and {} name the same counter {}, keeping {}",
                        previous, spelling, key.get(), kept);
                events.with(key.get(), kept);
            });
        });
        return events;
    }

    public String toJson(EventSet events) {
        try {
            return objectMapper.writeValueAsString(encode(events));
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Could not serialize event stats", e);
        }
    }

    public EventSet fromJson(String json) {
        try {
            return decode(objectMapper.readValue(json, EventStatsSpec.class));
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Could not parse persisted event stats: " + json, e);
        }
    }

    private static Optional<CounterKey> resolve(String category, String action) {
        Optional<Category> c = Category.fromWireName(category);
        Optional<Action> a = Action.fromWireName(action);
        if (c.isEmpty() || a.isEmpty() || !c.get().supports(a.get())) {
            return Optional.empty();
        }
        return Optional.of(CounterKey.of(c.get(), a.get()));
    }

    private static boolean isCanonicalCategory(String category) {
        return Category.fromWireName(category)
                .map(c -> c.wireName().equals(category))
                .orElse(false);
    }

    private static long checkedCount(String category, String action, Long value) {
        if (value == null || value < 0 || value > MAX_COUNTER) {
            throw new EventStoreException(
                    "Persisted counter " + category + "." + action + " is not a valid uint32: " + value);
        }
        return value;
    }
}
