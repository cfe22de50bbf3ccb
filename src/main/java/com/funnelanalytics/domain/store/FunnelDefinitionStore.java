package com.funnelanalytics.domain.store;

import com.funnelanalytics.domain.model.FunnelDefinition;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to funnel definitions. Definitions are maintained elsewhere.
 */
public interface FunnelDefinitionStore {

    /**
     * Definition of {@code funnelId} if it belongs to {@code ownerId}.
     */
    Optional<FunnelDefinition> getDefinition(UUID funnelId, UUID ownerId);
}
