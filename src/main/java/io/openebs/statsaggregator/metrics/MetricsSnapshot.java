package io.openebs.statsaggregator.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of operational metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "not happened yet"
 */
public record MetricsSnapshot(

        /* -------- Ingestion -------- */
        long messagesReceived,
        long messagesApplied,
        long parseErrors,
        long invalidKeys,

        /* -------- Reconciliation -------- */
        long reconcileSucceeded,
        long reconcileFailed,
        Instant lastReconciledAt,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
