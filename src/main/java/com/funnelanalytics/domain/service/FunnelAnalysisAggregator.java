package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.DropOffPoint;
import com.funnelanalytics.domain.model.FunnelAnalysis;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.StepAnalysis;
import com.funnelanalytics.domain.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Combines step analysis with whole-funnel completion statistics.
 */
@Component
public class FunnelAnalysisAggregator {

    public FunnelAnalysis aggregate(FunnelDefinition definition,
                                    Map<String, Session> sessions,
                                    List<StepAnalysis> stepAnalyses,
                                    TimeWindow window) {
        CompletionSummary completion = CompletionSummary.of(sessions.values(), definition.lastStepNumber());

        return FunnelAnalysis.builder()
                .funnelId(definition.getId())
                .funnelName(definition.getName())
                .periodStart(window.getStart())
                .periodEnd(window.getEnd())
                .totalSessions(sessions.size())
                .completionRate(completion.getCompletionRate())
                .averageTimeToComplete(completion.getAvgCompletionTime())
                .steps(stepAnalyses)
                .dropOffPoints(rankDropOffPoints(stepAnalyses))
                .build();
    }

    /**
     * Steps that lose sessions, worst drop-off rate first. The sort is stable,
     * so equal rates keep step order.
     */
    public List<DropOffPoint> rankDropOffPoints(List<StepAnalysis> stepAnalyses) {
        return stepAnalyses.stream()
                .filter(step -> step.getDropOffRate() > 0)
                .map(step -> DropOffPoint.builder()
                        .step(step.getStep())
                        .stepNumber(step.getStepNumber())
                        .dropOffCount(step.getDroppedUsers())
                        .dropOffRate(step.getDropOffRate())
                        .build())
                .sorted(Comparator.comparingDouble(DropOffPoint::getDropOffRate).reversed())
                .toList();
    }
}
