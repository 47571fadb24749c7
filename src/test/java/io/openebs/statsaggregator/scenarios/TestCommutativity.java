package io.openebs.statsaggregator.scenarios;

import io.openebs.statsaggregator.engine.EventIngestor;
import io.openebs.statsaggregator.model.EventSet;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static io.openebs.statsaggregator.testutil.TestFactory.total;
import static io.openebs.statsaggregator.testutil.TestFactory.json;
import static org.assertj.core.api.Assertions.assertThat;

public class TestCommutativity {

    private static EventSet process(List<String> payloads) {
        EventsCache cache = TestFactory.initializedCache();
        EventIngestor ingestor = TestFactory.createIngestor(cache);
        payloads.forEach(ingestor::ingest);
        return cache.snapshot();
    }

    /**
     * Counters depend only on the multiset of (category, action) pairs, not on delivery order.
     * Invalid and malformed messages are mixed in and must not change that.
     */
    @Test
    void testAnyDeliveryOrderGivesSameCounters() {
        List<String> payloads = new ArrayList<>(List.of(
                json("1", "Volume", "Created"),
                json("2", "Volume", "Created"),
                json("3", "Volume", "Deleted"),
                json("4", "Pool", "Created"),
                json("5", "Replica", "Deleted"),
                json("6", "Nexus", "Changed"),
                json("7", "Nexus", "Changed"),
                json("8", "Volume", "Changed"),
                json("9", "Unknown", "Created"),
                "{not json"
        ));
        EventSet expected = process(payloads);

        Random random = new Random(42);
        for (int i = 0; i < 50; i++) {
            List<String> shuffled = new ArrayList<>(payloads);
            Collections.shuffle(shuffled, random);
            assertThat(process(shuffled)).isEqualTo(expected);
        }
        assertThat(total(expected)).isEqualTo(7);
    }
}
