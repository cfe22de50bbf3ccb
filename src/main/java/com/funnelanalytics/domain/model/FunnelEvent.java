package com.funnelanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of one session touching one funnel step.
 */
@Value
@Builder
public class FunnelEvent {

    UUID id;
    UUID ownerId;
    UUID funnelId;
    String sessionId;
    String step;
    int stepNumber;
    Instant timestamp;
    Map<String, Object> metadata;
}
