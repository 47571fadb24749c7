package io.openebs.statsaggregator.metrics;

/**
 * Operational counters for the ingestion listener and the reconciler,
 * exposed via /stats/ingestion and alongside the event gauges.
 */
public interface Metrics {

    void onMessageReceived();

    void onMessageApplied();

    void onParseError();

    void onInvalidKey();

    void onReconcileSucceeded();

    void onReconcileFailed();

    MetricsSnapshot snapshot();
}
