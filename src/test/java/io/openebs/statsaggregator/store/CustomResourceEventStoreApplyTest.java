package io.openebs.statsaggregator.store;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.openebs.statsaggregator.engine.EventReconciler;
import io.openebs.statsaggregator.exception.EventStoreException;
import io.openebs.statsaggregator.metrics.NoOpMetrics;
import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.model.CounterKey;
import io.openebs.statsaggregator.model.EventSet;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.testutil.TestFactory;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Server-side apply requests sent for the custom resource, checked on the wire.
 */
@EnableKubernetesMockClient
public class CustomResourceEventStoreApplyTest {

    private static final String APPLY_PATH =
            "/apis/openebs.io/v1alpha1/namespaces/mayastor/eventstats/eventstats?fieldManager=events_store&force=true";

    static KubernetesMockServer server;
    static KubernetesClient client;

    private EventSetCodec codec;
    private CustomResourceEventStore store;

    @BeforeEach
    void setUp() {
        codec = new EventSetCodec(TestFactory.objectMapper());
        store = new CustomResourceEventStore(client, codec, "mayastor", "eventstats", "events_store");
    }

    @Test
    void testApplyIsForcedServerSideApplyWithFieldManager() throws InterruptedException {
        EventSet events = EventSet.zero()
                .with(CounterKey.of(Category.VOLUME, Action.CREATED), 6)
                .withForeign("Snapshot", "Created", 3);
        server.expect().patch().withPath(APPLY_PATH)
                .andReturn(200, EventStatsResource.of("mayastor", "eventstats", codec.encode(events)))
                .once();

        store.apply(events);

        RecordedRequest request = server.getLastRequest();
        assertThat(request.getMethod()).isEqualTo("PATCH");
        assertThat(request.getHeader("Content-Type")).startsWith("application/apply-patch+yaml");
        assertThat(request.getPath()).contains("fieldManager=events_store").contains("force=true");

        EventStatsResource sent = Serialization.unmarshal(request.getBody().readUtf8(), EventStatsResource.class);
        assertThat(sent.getMetadata().getName()).isEqualTo("eventstats");
        Map<String, Map<String, Long>> sentEvents = sent.getSpec().getEvents();
        assertThat(sentEvents.get("Volume")).containsEntry("Created", 6L).containsEntry("Deleted", 0L);
        assertThat(sentEvents.get("Nexus")).containsEntry("Changed", 0L);
        assertThat(sentEvents.get("Snapshot")).containsEntry("Created", 3L);
        assertThat(codec.decode(sent.getSpec())).isEqualTo(events);
    }

    @Test
    void testReconcileWritesCurrentCounters() throws InterruptedException {
        EventsCache cache = TestFactory.initializedCache();
        cache.increment(Category.POOL, Action.DELETED);
        server.expect().patch().withPath(APPLY_PATH)
                .andReturn(200, EventStatsResource.of("mayastor", "eventstats", codec.encode(cache.snapshot())))
                .once();

        assertThat(new EventReconciler(cache, store, new NoOpMetrics()).reconcileOnce()).isTrue();

        EventStatsResource sent = Serialization.unmarshal(
                server.getLastRequest().getBody().readUtf8(), EventStatsResource.class);
        assertThat(sent.getSpec().getEvents().get("Pool")).containsEntry("Deleted", 1L);
    }

    @Test
    void testRejectedApplyIsAStoreError() {
        server.expect().patch().withPath(APPLY_PATH).andReturn(500, "boom").once();

        assertThatThrownBy(() -> store.apply(EventSet.zero()))
                .isInstanceOf(EventStoreException.class)
                .hasMessageContaining("eventstats");
    }
}
