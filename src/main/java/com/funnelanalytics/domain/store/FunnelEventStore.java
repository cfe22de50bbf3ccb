package com.funnelanalytics.domain.store;

import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.TimeWindow;

import java.util.List;
import java.util.UUID;

/**
 * Append-only event storage.
 */
public interface FunnelEventStore {

    /**
     * Events of one funnel inside the window, optionally for a single session,
     * ordered by session id, step number and timestamp.
     *
     * @param sessionId null for every session
     */
    List<FunnelEvent> queryEvents(UUID funnelId, String sessionId, TimeWindow window);

    FunnelEvent appendEvent(FunnelEvent event);
}
