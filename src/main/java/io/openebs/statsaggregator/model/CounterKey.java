package io.openebs.statsaggregator.model;

import io.openebs.statsaggregator.exception.InvalidCounterKeyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A (category, action) pair identifying one counter.
 * Only pairs where the category supports the action can be constructed.
 */
public record CounterKey(Category category, Action action) {

    private static final List<CounterKey> ALL = buildAll();

    public CounterKey {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(action, "action");
        if (!category.supports(action)) {
            throw new InvalidCounterKeyException(category.wireName(), action.wireName());
        }
    }

    public static CounterKey of(Category category, Action action) {
        return new CounterKey(category, action);
    }

    /**
     * Resolve a key from its wire names, case-insensitively.
     *
     * @throws InvalidCounterKeyException if either name is unknown or the pair is not counted
     */
    public static CounterKey parse(String category, String action) {
        Category c = Category.fromWireName(category)
                .orElseThrow(() -> new InvalidCounterKeyException(category, action));
        Action a = Action.fromWireName(action)
                .orElseThrow(() -> new InvalidCounterKeyException(category, action));
        return new CounterKey(c, a);
    }

    /**
     * Every valid key, in declaration order of categories then actions.
     */
    public static List<CounterKey> all() {
        return ALL;
    }

    private static List<CounterKey> buildAll() {
        List<CounterKey> keys = new ArrayList<>();
        for (Category category : Category.values()) {
            for (Action action : category.actions()) {
                keys.add(new CounterKey(category, action));
            }
        }
        return Collections.unmodifiableList(keys);
    }

    @Override
    public String toString() {
        return category.wireName() + "." + action.wireName();
    }
}
