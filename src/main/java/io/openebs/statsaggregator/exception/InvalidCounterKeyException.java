package io.openebs.statsaggregator.exception;

import lombok.Getter;

/**
 * Raised when an event names a category/action pair that is not counted.
 */
@Getter
public class InvalidCounterKeyException extends RuntimeException {

    private final String category;
    private final String action;

    public InvalidCounterKeyException(String category, String action) {
        super("No counter for category '" + category + "' and action '" + action + "'");
        this.category = category;
        this.action = action;
    }
}
