package io.openebs.statsaggregator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openebs.statsaggregator.exception.CacheNotInitializedException;
import io.openebs.statsaggregator.exception.InvalidCounterKeyException;
import io.openebs.statsaggregator.metrics.Metrics;
import io.openebs.statsaggregator.model.CounterKey;
import io.openebs.statsaggregator.model.EventMessage;
import io.openebs.statsaggregator.state.EventsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies bus messages to the events cache.
 * <p>
 * Data errors never escape: a payload that does not parse, or that names a pair we do
 * not count, is logged and reported so the caller can acknowledge it and move on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventIngestor {

    private final EventsCache cache;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    /**
     * Parse and apply a raw payload.
     */
    public IngestOutcome ingest(String payload) {
        metrics.onMessageReceived();
        EventMessage message;
        try {
            message = objectMapper.readValue(payload, EventMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            metrics.onParseError();
            log.warn("Dropping malformed event message {}: {}", payload, e.getMessage());
            return IngestOutcome.DROPPED_MALFORMED;
        }
        if (message == null) {
            metrics.onParseError();
            log.warn("Dropping empty event message");
            return IngestOutcome.DROPPED_MALFORMED;
        }
        return applyMessage(message);
    }

    private IngestOutcome applyMessage(EventMessage message) {
        try {
            cache.increment(CounterKey.parse(message.getCategory(), message.getAction()));
        } catch (InvalidCounterKeyException e) {
            metrics.onInvalidKey();
            log.warn("Dropping event {}: {} (target={}, node={})",
                    message.getId(), e.getMessage(), message.getTarget(), message.getNode());
            return IngestOutcome.DROPPED_INVALID_KEY;
        } catch (CacheNotInitializedException e) {
            log.error("Event {} received before the events cache was initialized, skipping", message.getId());
            return IngestOutcome.SKIPPED_NOT_READY;
        }
        metrics.onMessageApplied();
        log.debug("Counted event {} {}.{} (target={}, node={})",
                message.getId(), message.getCategory(), message.getAction(),
                message.getTarget(), message.getNode());
        return IngestOutcome.APPLIED;
    }
}
