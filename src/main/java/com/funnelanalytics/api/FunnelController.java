package com.funnelanalytics.api;

import com.funnelanalytics.domain.model.CohortData;
import com.funnelanalytics.domain.model.FunnelAnalysis;
import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.FunnelMetrics;
import com.funnelanalytics.domain.model.MaterializedMetricsResponse;
import com.funnelanalytics.domain.model.SegmentData;
import com.funnelanalytics.domain.model.StepAnalysis;
import com.funnelanalytics.domain.service.FunnelAnalyticsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for funnel tracking and analysis.
 *
 * Endpoints (all under /api/v1/funnels/{funnelId}, owner in X-Owner-Id):
 * - POST /events - Track an event
 * - GET /steps - Per-step conversion
 * - GET /analysis - Whole-funnel report
 * - GET /cohort-analysis - Completion by entry cohort
 * - GET /segment-analysis - Completion by metadata segment
 * - POST /metrics/calculate - Materialize one period
 * - GET /metrics - Read materialized metrics
 *
 * periodStart / periodEnd are ISO-8601 instants; when absent the window is the
 * last 30 days.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/funnels/{funnelId}")
@RequiredArgsConstructor
public class FunnelController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final FunnelAnalyticsService analyticsService;

    @PostMapping("/events")
    public ResponseEntity<FunnelEvent> trackEvent(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @Valid @RequestBody TrackEventRequest request) {

        FunnelEvent event = analyticsService.trackEvent(
                ownerId,
                funnelId,
                request.getSessionId(),
                request.getStep(),
                request.getStepNumber(),
                request.getMetadata()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/steps")
    public ResponseEntity<List<StepAnalysis>> getStepAnalysis(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodEnd) {

        log.info("Step analysis: funnelId={}, periodStart={}, periodEnd={}", funnelId, periodStart, periodEnd);

        return ResponseEntity.ok(analyticsService.getStepAnalysis(ownerId, funnelId, periodStart, periodEnd));
    }

    @GetMapping("/analysis")
    public ResponseEntity<FunnelAnalysis> getFunnelAnalysis(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodEnd) {

        log.info("Funnel analysis: funnelId={}, periodStart={}, periodEnd={}", funnelId, periodStart, periodEnd);

        return ResponseEntity.ok(analyticsService.getFunnelAnalysis(ownerId, funnelId, periodStart, periodEnd));
    }

    /**
     * GET /cohort-analysis?cohortBy=day|week|month (default day)
     */
    @GetMapping("/cohort-analysis")
    public ResponseEntity<List<CohortData>> getCohortAnalysis(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodEnd,
            @RequestParam(required = false) String cohortBy) {

        log.info("Cohort analysis: funnelId={}, cohortBy={}", funnelId, cohortBy);

        return ResponseEntity.ok(
                analyticsService.getCohortAnalysis(ownerId, funnelId, periodStart, periodEnd, cohortBy));
    }

    /**
     * GET /segment-analysis?segmentBy=browser (required)
     */
    @GetMapping("/segment-analysis")
    public ResponseEntity<List<SegmentData>> getSegmentAnalysis(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @RequestParam(required = false) String segmentBy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant periodEnd) {

        log.info("Segment analysis: funnelId={}, segmentBy={}", funnelId, segmentBy);

        return ResponseEntity.ok(
                analyticsService.getSegmentAnalysis(ownerId, funnelId, segmentBy, periodStart, periodEnd));
    }

    @PostMapping("/metrics/calculate")
    public ResponseEntity<List<FunnelMetrics>> calculateMetrics(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @Valid @RequestBody CalculateMetricsRequest request) {

        log.info("Calculate metrics: funnelId={}, periodStart={}, periodEnd={}",
                funnelId, request.getPeriodStart(), request.getPeriodEnd());

        return ResponseEntity.ok(analyticsService.calculateMetrics(
                ownerId, funnelId, request.getPeriodStart(), request.getPeriodEnd()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<MaterializedMetricsResponse> getFunnelMetrics(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID funnelId,
            @RequestParam(required = false) String period) {

        log.info("Get metrics: funnelId={}, period={}", funnelId, period);

        return ResponseEntity.ok(analyticsService.getFunnelMetrics(ownerId, funnelId, period));
    }
}
