package com.funnelanalytics.infrastructure.persistence;

import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelMetrics;
import com.funnelanalytics.domain.store.FunnelMetricsStore;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsRepository;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsUpsertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Reads through JPA, writes through the JDBC upsert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFunnelMetricsStore implements FunnelMetricsStore {

    private final FunnelMetricsRepository metricsRepository;
    private final FunnelMetricsUpsertRepository upsertRepository;

    @Override
    public void upsert(FunnelMetrics metrics) {
        try {
            upsertRepository.upsert(metrics);
        } catch (DataAccessException e) {
            log.error("Error upserting metrics for funnel {} step {} period {}: {}",
                    metrics.getFunnelId(), metrics.getStep(), metrics.getPeriod(), e.getMessage(), e);
            throw new StorageFailureException("Metrics store unavailable", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<FunnelMetrics> findMetrics(UUID funnelId, String period) {
        try {
            List<FunnelMetricsEntity> rows = period != null
                    ? metricsRepository.findByFunnelIdAndPeriodOrderByStepNumberAsc(funnelId, period)
                    : metricsRepository.findByFunnelIdOrderByPeriodDescStepNumberAsc(funnelId);
            return rows.stream().map(this::toDomain).toList();

        } catch (DataAccessException e) {
            log.error("Error reading metrics for funnel {}: {}", funnelId, e.getMessage(), e);
            throw new StorageFailureException("Metrics store unavailable", e);
        }
    }

    private FunnelMetrics toDomain(FunnelMetricsEntity entity) {
        return FunnelMetrics.builder()
                .funnelId(entity.getFunnelId())
                .step(entity.getStep())
                .stepNumber(entity.getStepNumber())
                .totalCount(entity.getTotalCount())
                .conversionRate(entity.getConversionRate())
                .dropOffRate(entity.getDropOffRate())
                .avgTimeToNext(entity.getAvgTimeToNext())
                .period(entity.getPeriod())
                .periodStart(entity.getPeriodStart())
                .periodEnd(entity.getPeriodEnd())
                .build();
    }
}
