package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.exception.FunnelNotFoundException;
import com.funnelanalytics.domain.exception.InvalidInputException;
import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.CohortData;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.FunnelAnalysis;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.FunnelMetrics;
import com.funnelanalytics.domain.model.MaterializedMetricsResponse;
import com.funnelanalytics.domain.model.SegmentData;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.StepAnalysis;
import com.funnelanalytics.domain.model.TimeWindow;
import com.funnelanalytics.domain.store.FunnelDefinitionStore;
import com.funnelanalytics.domain.store.FunnelEventStore;
import com.funnelanalytics.domain.store.FunnelMetricsStore;
import com.funnelanalytics.infrastructure.cache.MetricsCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the funnel analytics engine.
 *
 * Every operation is scoped to (ownerId, funnelId): the definition is looked
 * up for that owner first, and a missing one is a NotFound.
 *
 * Analysis Flow:
 * 1. Validate input (window, cohortBy, segmentBy)
 * 2. Load the owner's funnel definition
 * 3. Reconstruct sessions for the window from the event store
 * 4. Run the analyzer and return its report
 *
 * Analyses hold no state between calls and may run concurrently. Only
 * materialized metric reads are cached; the cache entries of a period are
 * dropped when that period is recalculated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelAnalyticsService {

    private static final int MAX_TEXT_LENGTH = 255;

    private final FunnelDefinitionStore definitionStore;
    private final FunnelEventStore eventStore;
    private final FunnelMetricsStore metricsStore;
    private final SessionReconstructor sessionReconstructor;
    private final StepAnalyzer stepAnalyzer;
    private final FunnelAnalysisAggregator analysisAggregator;
    private final CohortAnalyzer cohortAnalyzer;
    private final SegmentAnalyzer segmentAnalyzer;
    private final MetricsMaterializer metricsMaterializer;
    private final MetricsCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${app.funnel.default-window-days:30}")
    private int defaultWindowDays = 30;

    @Value("${app.cache.ttl.metrics:3600}")
    private long metricsCacheTtl = 3600;

    /**
     * Appends one event. Rejected when the funnel is unknown to the owner or
     * has tracking disabled.
     */
    public FunnelEvent trackEvent(UUID ownerId, UUID funnelId, String sessionId,
                                  String step, int stepNumber, Map<String, Object> metadata) {
        requireText("sessionId", sessionId);
        requireText("step", step);
        if (stepNumber < 0) {
            throw new InvalidInputException("stepNumber must be >= 0, got " + stepNumber);
        }
        MetadataValidator.validate(metadata);

        FunnelDefinition definition = definitionStore.getDefinition(funnelId, ownerId)
                .filter(FunnelDefinition::isTrackingEnabled)
                .orElseThrow(() -> FunnelNotFoundException.trackingDisabled(funnelId));

        if (definition.stepAt(stepNumber).isEmpty()) {
            throw new InvalidInputException(
                    "stepNumber " + stepNumber + " is not a step of funnel " + funnelId);
        }

        FunnelEvent event = eventStore.appendEvent(FunnelEvent.builder()
                .ownerId(ownerId)
                .funnelId(funnelId)
                .sessionId(sessionId)
                .step(step)
                .stepNumber(stepNumber)
                .timestamp(clock.instant())
                .metadata(metadata)
                .build());

        Counter.builder("funnel.events.tracked")
                .register(meterRegistry)
                .increment();

        log.debug("Tracked event: funnel={}, session={}, step={}", funnelId, sessionId, stepNumber);
        return event;
    }

    public List<StepAnalysis> getStepAnalysis(UUID ownerId, UUID funnelId, Instant periodStart, Instant periodEnd) {
        TimeWindow window = TimeWindow.resolve(periodStart, periodEnd, clock, defaultWindowDays);

        return timed("steps", () -> {
            FunnelDefinition definition = loadDefinition(ownerId, funnelId);
            Map<String, Session> sessions = sessionReconstructor.reconstruct(funnelId, window);
            List<StepAnalysis> result = stepAnalyzer.analyze(definition.orderedSteps(), sessions.values());

            log.info("Step analysis: funnel={}, sessions={}, steps={}", funnelId, sessions.size(), result.size());
            return result;
        });
    }

    /**
     * Whole-funnel report. Without bounds the window is the last
     * {@code app.funnel.default-window-days} days ending now.
     */
    public FunnelAnalysis getFunnelAnalysis(UUID ownerId, UUID funnelId, Instant periodStart, Instant periodEnd) {
        TimeWindow window = TimeWindow.resolve(periodStart, periodEnd, clock, defaultWindowDays);

        return timed("funnel", () -> {
            FunnelDefinition definition = loadDefinition(ownerId, funnelId);
            Map<String, Session> sessions = sessionReconstructor.reconstruct(funnelId, window);
            List<StepAnalysis> steps = stepAnalyzer.analyze(definition.orderedSteps(), sessions.values());
            FunnelAnalysis analysis = analysisAggregator.aggregate(definition, sessions, steps, window);

            log.info("Funnel analysis: funnel={}, sessions={}, completionRate={}",
                    funnelId, analysis.getTotalSessions(), analysis.getCompletionRate());
            return analysis;
        });
    }

    public List<CohortData> getCohortAnalysis(UUID ownerId, UUID funnelId,
                                              Instant periodStart, Instant periodEnd, String cohortBy) {
        CohortGranularity granularity = CohortGranularity.fromValue(cohortBy);
        TimeWindow window = TimeWindow.resolve(periodStart, periodEnd, clock, defaultWindowDays);

        return timed("cohort", () -> {
            FunnelDefinition definition = loadDefinition(ownerId, funnelId);
            Map<String, Session> sessions = sessionReconstructor.reconstruct(funnelId, window);
            List<CohortData> result = cohortAnalyzer.analyze(definition, sessions, granularity);

            log.info("Cohort analysis: funnel={}, cohortBy={}, cohorts={}", funnelId, granularity, result.size());
            return result;
        });
    }

    public List<SegmentData> getSegmentAnalysis(UUID ownerId, UUID funnelId, String segmentBy,
                                                Instant periodStart, Instant periodEnd) {
        if (segmentBy == null || segmentBy.isBlank()) {
            throw new InvalidInputException("segmentBy is required");
        }
        TimeWindow window = TimeWindow.resolve(periodStart, periodEnd, clock, defaultWindowDays);

        return timed("segment", () -> {
            FunnelDefinition definition = loadDefinition(ownerId, funnelId);
            Map<String, Session> sessions = sessionReconstructor.reconstruct(funnelId, window);
            List<SegmentData> result = segmentAnalyzer.analyze(definition, sessions, segmentBy.trim());

            log.info("Segment analysis: funnel={}, segmentBy={}, segments={}", funnelId, segmentBy, result.size());
            return result;
        });
    }

    /**
     * Recomputes and upserts the metrics of one period. The period key is the
     * window's start date.
     */
    public List<FunnelMetrics> calculateMetrics(UUID ownerId, UUID funnelId, Instant periodStart, Instant periodEnd) {
        TimeWindow window = TimeWindow.of(periodStart, periodEnd);

        List<FunnelMetrics> rows = timed("materialize", () -> {
            FunnelDefinition definition = loadDefinition(ownerId, funnelId);
            return metricsMaterializer.materialize(definition, window);
        });

        cacheService.invalidatePeriod(funnelId, window.periodKey());

        Counter.builder("funnel.metrics.materialized")
                .register(meterRegistry)
                .increment();

        log.info("Calculated metrics for funnel {} period {}", funnelId, window.periodKey());
        return rows;
    }

    /**
     * Reads materialized metrics, optionally for a single {@code YYYY-MM-DD}
     * period.
     */
    public MaterializedMetricsResponse getFunnelMetrics(UUID ownerId, UUID funnelId, String period) {
        String normalizedPeriod = normalizePeriod(period);
        loadDefinition(ownerId, funnelId);

        Optional<MaterializedMetricsResponse> cached = cacheService.get(funnelId, normalizedPeriod);

        if (cached.isPresent()) {
            Counter.builder("funnel.metrics.cache")
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();

            MaterializedMetricsResponse response = cached.get();
            response.setCached(true);
            return response;
        }

        Counter.builder("funnel.metrics.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        long startTime = System.currentTimeMillis();
        List<FunnelMetrics> metrics = metricsStore.findMetrics(funnelId, normalizedPeriod);
        long queryTime = System.currentTimeMillis() - startTime;

        MaterializedMetricsResponse response = MaterializedMetricsResponse.builder()
                .funnelId(funnelId)
                .period(normalizedPeriod)
                .metrics(metrics)
                .cached(false)
                .queryTimeMs(queryTime)
                .build();

        cacheService.put(response, metricsCacheTtl);

        log.info("Metrics read: funnel={}, period={}, rows={}, {} ms",
                funnelId, normalizedPeriod, metrics.size(), queryTime);
        return response;
    }

    private FunnelDefinition loadDefinition(UUID ownerId, UUID funnelId) {
        if (ownerId == null || funnelId == null) {
            throw new InvalidInputException("ownerId and funnelId are required");
        }
        return definitionStore.getDefinition(funnelId, ownerId)
                .orElseThrow(() -> FunnelNotFoundException.forOwner(funnelId, ownerId));
    }

    private <T> T timed(String type, Supplier<T> operation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return operation.get();
        } catch (FunnelNotFoundException | InvalidInputException e) {
            outcome = "rejected";
            log.debug("Funnel {} request rejected: {}", type, e.getMessage());
            throw e;
        } catch (StorageFailureException e) {
            // already logged with its cause by the store adapter
            outcome = "error";
            log.warn("Funnel {} operation failed: {}", type, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Funnel {} operation failed: {}", type, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(Timer.builder("funnel.analysis.latency")
                    .tag("type", type)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private static String normalizePeriod(String period) {
        if (period == null || period.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(period.trim()).toString();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("period must be formatted YYYY-MM-DD, got " + period);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
        if (value.length() > MAX_TEXT_LENGTH) {
            throw new InvalidInputException(field + " must be at most " + MAX_TEXT_LENGTH + " characters");
        }
    }
}
