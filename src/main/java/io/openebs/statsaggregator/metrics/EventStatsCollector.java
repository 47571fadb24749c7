package io.openebs.statsaggregator.metrics;

import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.model.EventSet;
import io.openebs.statsaggregator.state.EventsCache;
import io.prometheus.client.Collector;
import io.prometheus.client.CounterMetricFamily;
import io.prometheus.client.GaugeMetricFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Prometheus collector turning the events cache into one gauge family per category,
 * with one sample per counted action, labelled {@code action}.
 * <p>
 * Each scrape reads the cache exactly once, so all samples of a response come from the
 * same snapshot. Before bootstrap the scrape is empty.
 */
@Slf4j
public class EventStatsCollector extends Collector implements Collector.Describable {

    static final String ACTION_LABEL = "action";
    static final String PARSE_ERRORS = "stats_aggregator_parse_errors";
    static final String INVALID_KEYS = "stats_aggregator_invalid_keys";

    private final EventsCache cache;
    private final Metrics metrics;

    public EventStatsCollector(EventsCache cache, Metrics metrics) {
        this.cache = cache;
        this.metrics = metrics;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        Optional<EventSet> snapshot = cache.trySnapshot();
        if (snapshot.isEmpty()) {
            log.warn("Scrape before events cache initialization, returning no metrics");
            return Collections.emptyList();
        }
        EventSet events = snapshot.get();

        List<MetricFamilySamples> mfs = new ArrayList<>();
        for (Category category : Category.values()) {
            GaugeMetricFamily family = categoryFamily(category);
            for (Action action : category.actions()) {
                family.addMetric(
                        Collections.singletonList(action.labelValue()),
                        events.get(category, action)
                );
            }
            mfs.add(family);
        }

        MetricsSnapshot ops = metrics.snapshot();
        mfs.add(new CounterMetricFamily(PARSE_ERRORS,
                "Bus messages dropped because they could not be parsed", ops.parseErrors()));
        mfs.add(new CounterMetricFamily(INVALID_KEYS,
                "Bus messages dropped because their category/action pair is not counted", ops.invalidKeys()));
        return mfs;
    }

    @Override
    public List<MetricFamilySamples> describe() {
        List<MetricFamilySamples> mfs = new ArrayList<>();
        for (Category category : Category.values()) {
            mfs.add(categoryFamily(category));
        }
        mfs.add(new CounterMetricFamily(PARSE_ERRORS, "", Collections.emptyList()));
        mfs.add(new CounterMetricFamily(INVALID_KEYS, "", Collections.emptyList()));
        return mfs;
    }

    private static GaugeMetricFamily categoryFamily(Category category) {
        return new GaugeMetricFamily(
                category.metricName(),
                category.wireName() + " stat",
                Collections.singletonList(ACTION_LABEL)
        );
    }
}
