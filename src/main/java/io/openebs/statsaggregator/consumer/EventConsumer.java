package io.openebs.statsaggregator.consumer;

import io.openebs.statsaggregator.engine.EventIngestor;
import io.openebs.statsaggregator.engine.IngestOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer feeding lifecycle events into the events cache.
 *
 * The container polls one record at a time and commits its offset right after it is
 * applied, so at most one message is ever unacknowledged. A record that is still in
 * flight when the container stops is redelivered after restart; counting is commutative,
 * so redelivery order does not matter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventConsumer {

    private final EventIngestor ingestor;

    /**
     * - Apply the record through the ingestor
     * - Acknowledge the offset, also for dropped records so they are not redelivered forever
     * - Leave unexpected failures unacknowledged for the container's error handler
     */
    @KafkaListener(
        topics = "${kafka.topics.events:stats.events}",
        groupId = "${kafka.consumer.group-id:stats-consumer}",
        containerFactory = "eventListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        try {
            log.debug("Received event from partition {} at offset {}",
                record.partition(), record.offset());

            IngestOutcome outcome = ingestor.ingest(record.value());

            acknowledgment.acknowledge();

            log.debug("Acknowledged event from partition {} offset {} ({})",
                record.partition(), record.offset(), outcome);

        } catch (Exception e) {
            log.error("Error processing event from partition {} offset {}: {}",
                record.partition(), record.offset(), record.value(), e);
            // Don't acknowledge - will be retried
            throw new IllegalStateException("Failed to process event", e);
        }
    }
}
