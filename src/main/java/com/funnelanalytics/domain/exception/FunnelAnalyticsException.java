package com.funnelanalytics.domain.exception;

/**
 * Base type for every failure surfaced by the funnel analytics engine.
 */
public class FunnelAnalyticsException extends RuntimeException {

    public FunnelAnalyticsException(String message) {
        super(message);
    }

    public FunnelAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
