package io.openebs.statsaggregator.exception;

/**
 * The events cache was used before bootstrap seeded it.
 * Indicates a start-up ordering bug rather than a runtime condition.
 */
public class CacheNotInitializedException extends IllegalStateException {

    public CacheNotInitializedException() {
        super("Events cache is not initialized");
    }
}
