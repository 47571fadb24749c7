package io.openebs.statsaggregator.engine;

/**
 * What happened to one bus message. Every outcome is acknowledged.
 */
public enum IngestOutcome {
    APPLIED,
    DROPPED_MALFORMED,
    DROPPED_INVALID_KEY,
    SKIPPED_NOT_READY
}
