package io.openebs.statsaggregator.exception;

/**
 * The persisted counters could not be loaded or created at start-up.
 * Fatal: the process must not start counting from an assumed zero state.
 */
public class BootstrapException extends RuntimeException {

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
