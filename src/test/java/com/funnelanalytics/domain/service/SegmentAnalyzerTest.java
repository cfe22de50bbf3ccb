package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.SegmentData;
import com.funnelanalytics.domain.model.Session;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.funnelanalytics.domain.service.FunnelFixtures.T0;
import static com.funnelanalytics.domain.service.FunnelFixtures.event;
import static com.funnelanalytics.domain.service.FunnelFixtures.funnel;
import static org.junit.jupiter.api.Assertions.*;

class SegmentAnalyzerTest {

    private final SegmentAnalyzer segmentAnalyzer = new SegmentAnalyzer();
    private final FunnelDefinition definition = funnel("Visit", "Signup", "Purchase");

    @Test
    void testAnalyze_GroupsByEntryEventMetadata() {
        // Given
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "c1", 2, Map.of("browser", "chrome"));
        addJourney(events, "c2", 0, Map.of("browser", "chrome"));
        addJourney(events, "c3", 1, Map.of("browser", "chrome"));
        addJourney(events, "f1", 2, Map.of("browser", "firefox"));
        Map<String, Session> sessions = SessionReconstructor.groupBySession(events);

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(definition, sessions, "browser");

        // Then
        assertEquals(List.of("chrome", "firefox"), segments.stream().map(SegmentData::getSegment).toList());

        SegmentData chrome = segments.get(0);
        assertEquals(3, chrome.getTotalUsers());
        assertEquals(100.0 / 3, chrome.getCompletionRate(), 1e-9);
        assertEquals(120.0, chrome.getAvgCompletionTime());

        SegmentData firefox = segments.get(1);
        assertEquals(1, firefox.getTotalUsers());
        assertEquals(SegmentData.NO_DROP_OFF, firefox.getTopDropOffStep());
    }

    @Test
    void testAnalyze_MissingMetadataGoesToUnknown() {
        // Given: one session without metadata, one without the requested key
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "bare", 1, null);
        addJourney(events, "other", 2, Map.of("device", "mobile"));
        addJourney(events, "tagged", 2, Map.of("browser", "safari"));

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "browser");

        // Then
        assertEquals(2, segments.size());
        SegmentData unknown = segments.get(0);
        assertEquals(SegmentData.UNKNOWN_SEGMENT, unknown.getSegment());
        assertEquals(2, unknown.getTotalUsers());
        assertEquals(3, segments.stream().mapToLong(SegmentData::getTotalUsers).sum());
    }

    @Test
    void testAnalyze_NullAndBlankValuesAreUnknown() {
        // Given
        Map<String, Object> nullValue = new HashMap<>();
        nullValue.put("browser", null);
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "n", 0, nullValue);
        addJourney(events, "b", 0, Map.of("browser", "  "));

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "browser");

        // Then
        assertEquals(1, segments.size());
        assertEquals(SegmentData.UNKNOWN_SEGMENT, segments.get(0).getSegment());
    }

    @Test
    void testAnalyze_SegmentKeyComesFromFirstEventOnly() {
        // Given: the later event carries a different value
        List<FunnelEvent> events = List.of(
                event("s", 0, T0, Map.of("source", "ads")),
                event("s", 1, T0.plusSeconds(30), Map.of("source", "email"))
        );

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "source");

        // Then
        assertEquals("ads", segments.get(0).getSegment());
    }

    @Test
    void testAnalyze_NonStringValuesAreStringified() {
        // Given
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "s", 0, Map.of("plan", 3));

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "plan");

        // Then
        assertEquals("3", segments.get(0).getSegment());
    }

    @Test
    void testAnalyze_TopDropOffStep() {
        // Given: two sessions stop after Visit, one after Signup
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "a", 0, Map.of("device", "mobile"));
        addJourney(events, "b", 0, Map.of("device", "mobile"));
        addJourney(events, "c", 1, Map.of("device", "mobile"));
        addJourney(events, "d", 2, Map.of("device", "mobile"));

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "device");

        // Then
        assertEquals("Signup", segments.get(0).getTopDropOffStep());
    }

    @Test
    void testAnalyze_TopDropOffTieGoesToFirstEncountered() {
        // Given: one drop before Purchase (session "a"), one before Signup (session "b")
        List<FunnelEvent> events = new ArrayList<>();
        addJourney(events, "a", 1, Map.of("device", "tablet"));
        addJourney(events, "b", 0, Map.of("device", "tablet"));

        // When
        List<SegmentData> segments = segmentAnalyzer.analyze(
                definition, SessionReconstructor.groupBySession(events), "device");

        // Then
        assertEquals("Purchase", segments.get(0).getTopDropOffStep());
    }

    private static void addJourney(List<FunnelEvent> events, String sessionId, int lastStep,
                                   Map<String, Object> metadata) {
        for (int step = 0; step <= lastStep; step++) {
            events.add(event(sessionId, step, T0.plusSeconds(60L * step), metadata));
        }
    }
}
