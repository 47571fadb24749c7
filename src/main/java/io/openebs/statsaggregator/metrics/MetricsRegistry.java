package io.openebs.statsaggregator.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesApplied = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong invalidKeys = new AtomicLong();

    private final AtomicLong reconcileSucceeded = new AtomicLong();
    private final AtomicLong reconcileFailed = new AtomicLong();
    private final AtomicReference<Instant> lastReconciledAt = new AtomicReference<>();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    @Override
    public void onMessageReceived() {
        messagesReceived.incrementAndGet();
        touch();
    }

    @Override
    public void onMessageApplied() {
        messagesApplied.incrementAndGet();
        touch();
    }

    @Override
    public void onParseError() {
        parseErrors.incrementAndGet();
        touch();
    }

    @Override
    public void onInvalidKey() {
        invalidKeys.incrementAndGet();
        touch();
    }

    @Override
    public void onReconcileSucceeded() {
        reconcileSucceeded.incrementAndGet();
        lastReconciledAt.set(Instant.now());
        touch();
    }

    @Override
    public void onReconcileFailed() {
        reconcileFailed.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                messagesReceived.get(),
                messagesApplied.get(),
                parseErrors.get(),
                invalidKeys.get(),
                reconcileSucceeded.get(),
                reconcileFailed.get(),
                lastReconciledAt.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
