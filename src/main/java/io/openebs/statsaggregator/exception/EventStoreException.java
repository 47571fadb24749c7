package io.openebs.statsaggregator.exception;

/**
 * Failure talking to the persisted counter store, or a stored document that cannot be decoded.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
