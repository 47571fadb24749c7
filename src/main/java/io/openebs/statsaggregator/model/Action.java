package io.openebs.statsaggregator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Verb applied to a resource in a lifecycle event.
 */
public enum Action {
    CREATED("Created"),
    DELETED("Deleted"),
    CHANGED("Changed");

    private final String wireName;

    Action(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in the persisted resource, e.g. "Created".
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Value of the "action" label on exported gauges, e.g. "created".
     */
    public String labelValue() {
        return wireName.toLowerCase();
    }

    public static Optional<Action> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
