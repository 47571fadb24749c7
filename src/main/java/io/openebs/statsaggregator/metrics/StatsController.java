package io.openebs.statsaggregator.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Scrape endpoint rendering the event gauges in Prometheus text format 0.0.4.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StatsController {

    private final CollectorRegistry statsCollectorRegistry;

    @GetMapping("/stats")
    public ResponseEntity<String> stats() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004)
                .body(render());
    }

    String render() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, statsCollectorRegistry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not encode event stats", e);
        }
        return writer.toString();
    }
}
