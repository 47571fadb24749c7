package io.openebs.statsaggregator.config;

import io.openebs.statsaggregator.metrics.EventStatsCollector;
import io.openebs.statsaggregator.metrics.Metrics;
import io.openebs.statsaggregator.state.EventsCache;
import io.prometheus.client.CollectorRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Dedicated Prometheus registry for the /stats scrape, holding only the event collector.
 */
@Configuration
public class StatsExporterConfig {

    @Bean
    public EventStatsCollector eventStatsCollector(EventsCache eventsCache, Metrics metrics) {
        return new EventStatsCollector(eventsCache, metrics);
    }

    @Bean
    public CollectorRegistry statsCollectorRegistry(EventStatsCollector eventStatsCollector) {
        CollectorRegistry registry = new CollectorRegistry();
        registry.register(eventStatsCollector);
        return registry;
    }
}
