package io.openebs.statsaggregator.consumer;

import io.openebs.statsaggregator.engine.EventIngestor;
import io.openebs.statsaggregator.model.Action;
import io.openebs.statsaggregator.model.Category;
import io.openebs.statsaggregator.state.EventsCache;
import io.openebs.statsaggregator.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import static io.openebs.statsaggregator.testutil.TestFactory.total;
import static io.openebs.statsaggregator.testutil.TestFactory.json;
import static io.openebs.statsaggregator.testutil.TestFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EventConsumerTest {

    @Test
    void testAppliedRecordIsAcknowledged() {
        EventsCache cache = TestFactory.initializedCache();
        EventConsumer consumer = new EventConsumer(TestFactory.createIngestor(cache));
        RecordingAcknowledgment ack = new RecordingAcknowledgment();

        consumer.consume(record(0, json("e1", "Pool", "Created")), ack);

        assertThat(ack.count()).isEqualTo(1);
        assertThat(cache.snapshot().get(Category.POOL, Action.CREATED)).isEqualTo(1);
    }

    /**
     * A malformed record must not block the partition: it is acknowledged and dropped.
     */
    @Test
    void testMalformedRecordIsAcknowledged() {
        EventsCache cache = TestFactory.initializedCache();
        EventConsumer consumer = new EventConsumer(TestFactory.createIngestor(cache));
        RecordingAcknowledgment ack = new RecordingAcknowledgment();

        consumer.consume(record(0, "garbage"), ack);

        assertThat(ack.isAcknowledged()).isTrue();
        assertThat(total(cache.snapshot())).isZero();
    }

    @Test
    void testUnexpectedFailureIsNotAcknowledged() {
        EventIngestor failing = new EventIngestor(TestFactory.initializedCache(), TestFactory.objectMapper(), null);
        EventConsumer consumer = new EventConsumer(failing);
        RecordingAcknowledgment ack = new RecordingAcknowledgment();

        assertThatThrownBy(() -> consumer.consume(record(0, json("e1", "Pool", "Created")), ack))
                .isInstanceOf(IllegalStateException.class);
        assertThat(ack.isAcknowledged()).isFalse();
    }
}
