package io.openebs.statsaggregator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the event stats aggregator.
 *
 * This application counts resource lifecycle events from Kafka, persists the counters
 * into a Kubernetes resource and serves them as Prometheus gauges.
 */
@Slf4j
@SpringBootApplication
public class StatsAggregatorApplication {

    public static void main(String[] args) {
        log.info("Starting Stats Aggregator Application...");
        SpringApplication.run(StatsAggregatorApplication.class, args);
        log.info("Stats Aggregator Application started successfully");
    }
}
