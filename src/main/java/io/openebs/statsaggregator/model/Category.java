package io.openebs.statsaggregator.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Kind of resource an event refers to, together with the actions that are counted for it.
 *
 * New categories can be appended here; persisted data is keyed by {@link #wireName()},
 * so older documents keep decoding.
 */
public enum Category {
    VOLUME("Volume", EnumSet.of(Action.CREATED, Action.DELETED)),
    POOL("Pool", EnumSet.of(Action.CREATED, Action.DELETED)),
    REPLICA("Replica", EnumSet.of(Action.CREATED, Action.DELETED)),
    NEXUS("Nexus", EnumSet.of(Action.CREATED, Action.DELETED, Action.CHANGED));

    private final String wireName;
    private final Set<Action> actions;

    Category(String wireName, EnumSet<Action> actions) {
        this.wireName = wireName;
        this.actions = Collections.unmodifiableSet(actions);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Metric family name used by the exporter, e.g. "volume".
     */
    public String metricName() {
        return wireName.toLowerCase();
    }

    public Set<Action> actions() {
        return actions;
    }

    public boolean supports(Action action) {
        return actions.contains(action);
    }

    public static Optional<Category> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
