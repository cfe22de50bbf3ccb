package com.funnelanalytics.domain.exception;

/**
 * The event, definition or metrics store could not be reached or failed.
 *
 * Not retried here; every operation is safe for the caller to repeat.
 */
public class StorageFailureException extends FunnelAnalyticsException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
