package com.funnelanalytics.domain.exception;

import java.util.UUID;

/**
 * The funnel does not exist for the requesting owner, or does not accept events.
 */
public class FunnelNotFoundException extends FunnelAnalyticsException {

    public FunnelNotFoundException(String message) {
        super(message);
    }

    public static FunnelNotFoundException forOwner(UUID funnelId, UUID ownerId) {
        return new FunnelNotFoundException("Funnel not found: " + funnelId + " (owner " + ownerId + ")");
    }

    public static FunnelNotFoundException trackingDisabled(UUID funnelId) {
        return new FunnelNotFoundException("Funnel not found or tracking disabled: " + funnelId);
    }
}
