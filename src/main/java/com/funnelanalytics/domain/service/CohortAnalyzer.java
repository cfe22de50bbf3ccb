package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.CohortData;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.Session;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets sessions by the date of their entry event and reports completion
 * per bucket.
 *
 * Every session lands in exactly one bucket; only observed cohorts are
 * emitted, sorted by key.
 */
@Component
public class CohortAnalyzer {

    public List<CohortData> analyze(FunnelDefinition definition,
                                    Map<String, Session> sessions,
                                    CohortGranularity granularity) {
        Map<String, List<Session>> cohorts = new TreeMap<>();
        for (Session session : sessions.values()) {
            String cohortKey = granularity.cohortKey(session.entryTime());
            cohorts.computeIfAbsent(cohortKey, key -> new ArrayList<>()).add(session);
        }

        int lastStepNumber = definition.lastStepNumber();
        List<CohortData> result = new ArrayList<>(cohorts.size());
        cohorts.forEach((cohortKey, members) -> {
            CompletionSummary completion = CompletionSummary.of(members, lastStepNumber);
            result.add(CohortData.builder()
                    .cohortDate(cohortKey)
                    .totalUsers(completion.getTotalUsers())
                    .completedUsers(completion.getCompletedUsers())
                    .completionRate(completion.getCompletionRate())
                    .avgCompletionTime(completion.getAvgCompletionTime())
                    .build());
        });
        return result;
    }
}
