package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.SegmentData;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets sessions by one metadata field of their entry event.
 *
 * Sessions without the field go to the "Unknown" segment. Output is largest
 * segment first.
 */
@Component
public class SegmentAnalyzer {

    public List<SegmentData> analyze(FunnelDefinition definition,
                                     Map<String, Session> sessions,
                                     String segmentBy) {
        Map<String, List<Session>> segments = new LinkedHashMap<>();
        for (Session session : sessions.values()) {
            segments.computeIfAbsent(segmentKey(session, segmentBy), key -> new ArrayList<>()).add(session);
        }

        int lastStepNumber = definition.lastStepNumber();
        List<SegmentData> result = new ArrayList<>(segments.size());
        segments.forEach((segment, members) -> {
            CompletionSummary completion = CompletionSummary.of(members, lastStepNumber);
            result.add(SegmentData.builder()
                    .segment(segment)
                    .totalUsers(completion.getTotalUsers())
                    .completionRate(completion.getCompletionRate())
                    .avgCompletionTime(completion.getAvgCompletionTime())
                    .topDropOffStep(topDropOffStep(definition, members, lastStepNumber))
                    .build());
        });

        result.sort(Comparator.comparingLong(SegmentData::getTotalUsers).reversed());
        return result;
    }

    static String segmentKey(Session session, String segmentBy) {
        Map<String, Object> metadata = session.entryEvent().getMetadata();
        if (metadata == null) {
            return SegmentData.UNKNOWN_SEGMENT;
        }
        Object value = metadata.get(segmentBy);
        if (value == null) {
            return SegmentData.UNKNOWN_SEGMENT;
        }
        String key = String.valueOf(value);
        return key.isBlank() ? SegmentData.UNKNOWN_SEGMENT : key;
    }

    /**
     * Attributes each unfinished session to the step right after the highest
     * one it reached. Ties go to the step tallied first.
     */
    private String topDropOffStep(FunnelDefinition definition, List<Session> members, int lastStepNumber) {
        Map<String, Integer> tally = new LinkedHashMap<>();
        for (Session session : members) {
            int maxStep = session.maxStepNumber();
            if (maxStep < lastStepNumber) {
                String stepName = definition.stepAt(maxStep + 1)
                        .map(FunnelStep::getName)
                        .orElse(SegmentData.UNKNOWN_SEGMENT);
                tally.merge(stepName, 1, Integer::sum);
            }
        }

        String top = SegmentData.NO_DROP_OFF;
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : tally.entrySet()) {
            if (entry.getValue() > topCount) {
                top = entry.getKey();
                topCount = entry.getValue();
            }
        }
        return top;
    }
}
