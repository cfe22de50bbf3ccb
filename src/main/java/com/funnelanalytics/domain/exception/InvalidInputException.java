package com.funnelanalytics.domain.exception;

/**
 * Request rejected before any data access.
 */
public class InvalidInputException extends FunnelAnalyticsException {

    public InvalidInputException(String message) {
        super(message);
    }
}
