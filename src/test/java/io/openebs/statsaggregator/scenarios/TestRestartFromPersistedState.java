package io.openebs.statsaggregator.scenarios;

import io.openebs.statsaggregator.engine.EventIngestor;
import io.openebs.statsaggregator.engine.EventReconciler;
import io.openebs.statsaggregator.metrics.NoOpMetrics;
import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.model.CounterKey;
import io.openebs.statsaggregator.model.EventSet;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.store.EventBootstrapLoader;
import io.openebs.statsaggregator.store.EventSetCodec;
import io.openebs.statsaggregator.store.InMemoryEventStore;
import io.openebs.statsaggregator.testutil.TestFactory;
import org.junit.jupiter.api.Test;
import org.springframework.util.backoff.FixedBackOff;

import static io.openebs.statsaggregator.testutil.TestFactory.json;
import static org.assertj.core.api.Assertions.assertThat;

public class TestRestartFromPersistedState {

    private static EventsCache boot(InMemoryEventStore store) {
        EventsCache cache = new EventsCache();
        cache.initialize(new EventBootstrapLoader(store, new FixedBackOff(0L, 0L)).load());
        return cache;
    }

    /**
     * Persisted {Volume:{Created:5,Deleted:0}}: Volume.Created starts at 5, everything else at 0.
     */
    @Test
    void testBootstrapSeedsCacheFromPersistedResource() {
        EventSetCodec codec = new EventSetCodec(TestFactory.objectMapper());
        InMemoryEventStore store = new InMemoryEventStore(
                codec.fromJson("{\"events\":{\"Volume\":{\"Created\":5,\"Deleted\":0}}}"));

        EventSet initial = boot(store).snapshot();

        assertThat(initial.get(Category.VOLUME, Action.CREATED)).isEqualTo(5);
        CounterKey.all().stream()
                .filter(key -> !key.equals(CounterKey.of(Category.VOLUME, Action.CREATED)))
                .forEach(key -> assertThat(initial.get(key)).as(key.toString()).isZero());
    }

    @Test
    void testCountsSurviveRestartAfterReconcile() {
        InMemoryEventStore store = new InMemoryEventStore();

        EventsCache first = boot(store);
        EventIngestor ingestor = TestFactory.createIngestor(first);
        ingestor.ingest(json("1", "Replica", "Created"));
        ingestor.ingest(json("2", "Replica", "Created"));
        new EventReconciler(first, store, new NoOpMetrics()).reconcile();

        // unreconciled increment, lost with the process
        ingestor.ingest(json("3", "Replica", "Created"));

        EventsCache second = boot(store);

        assertThat(second.snapshot().get(Category.REPLICA, Action.CREATED)).isEqualTo(2);
    }
}
