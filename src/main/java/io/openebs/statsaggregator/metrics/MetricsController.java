package io.openebs.statsaggregator.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint exposing ingestion and reconcile health as JSON.
 *
 * Used by debugging tools and tests.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final Metrics metrics;

    @GetMapping("/stats/ingestion")
    public MetricsSnapshot ingestion() {
        return metrics.snapshot();
    }
}
