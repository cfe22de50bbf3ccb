package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.TimeWindow;
import com.funnelanalytics.domain.store.FunnelEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Rebuilds per-session timelines from the event store.
 *
 * Two phases:
 * 1. Fetch every event of the funnel inside the window (one query)
 * 2. Group by session id into a map sorted by session id
 *
 * Sessions without events in the window are simply absent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionReconstructor {

    private final FunnelEventStore eventStore;

    public SortedMap<String, Session> reconstruct(UUID funnelId, TimeWindow window) {
        List<FunnelEvent> events = eventStore.queryEvents(funnelId, null, window);
        SortedMap<String, Session> sessions = groupBySession(events);

        log.debug("Reconstructed {} sessions from {} events for funnel {} in [{}, {}]",
                sessions.size(), events.size(), funnelId, window.getStart(), window.getEnd());

        return sessions;
    }

    /**
     * Groups a flat event list into sessions. Input order does not matter.
     */
    public static SortedMap<String, Session> groupBySession(List<FunnelEvent> events) {
        Map<String, List<FunnelEvent>> grouped = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            grouped.computeIfAbsent(event.getSessionId(), id -> new ArrayList<>()).add(event);
        }

        SortedMap<String, Session> sessions = new TreeMap<>();
        grouped.forEach((sessionId, sessionEvents) ->
                sessions.put(sessionId, new Session(sessionId, sessionEvents)));
        return sessions;
    }
}
