package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelMetrics;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.StepAnalysis;
import com.funnelanalytics.domain.model.TimeWindow;
import com.funnelanalytics.domain.store.FunnelMetricsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Persists per-step aggregates for one period.
 *
 * Materialization Flow:
 * 1. Reconstruct sessions strictly inside the period window
 * 2. Compute rows with the step analysis formulas (pure)
 * 3. Upsert each row keyed by (funnelId, step, period)
 *
 * Re-running a period overwrites its rows. Nothing accumulates, so the result
 * only depends on the stored events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsMaterializer {

    private final SessionReconstructor sessionReconstructor;
    private final StepAnalyzer stepAnalyzer;
    private final FunnelMetricsStore metricsStore;

    @Transactional
    public List<FunnelMetrics> materialize(FunnelDefinition definition, TimeWindow window) {
        Map<String, Session> sessions = sessionReconstructor.reconstruct(definition.getId(), window);
        List<FunnelMetrics> rows = computeMetrics(definition, sessions, window);

        rows.forEach(metricsStore::upsert);

        log.info("Materialized {} metric rows for funnel {} period {}",
                rows.size(), definition.getId(), window.periodKey());
        return rows;
    }

    public List<FunnelMetrics> computeMetrics(FunnelDefinition definition,
                                              Map<String, Session> sessions,
                                              TimeWindow window) {
        String period = window.periodKey();
        List<StepAnalysis> stepAnalyses = stepAnalyzer.analyze(definition.orderedSteps(), sessions.values());

        return stepAnalyses.stream()
                .map(step -> FunnelMetrics.builder()
                        .funnelId(definition.getId())
                        .step(step.getStep())
                        .stepNumber(step.getStepNumber())
                        .totalCount(step.getTotalUsers())
                        .conversionRate(step.getConversionRate())
                        .dropOffRate(step.getDropOffRate())
                        .avgTimeToNext(step.getAvgTimeToNext())
                        .period(period)
                        .periodStart(window.getStart())
                        .periodEnd(window.getEnd())
                        .build())
                .toList();
    }
}
