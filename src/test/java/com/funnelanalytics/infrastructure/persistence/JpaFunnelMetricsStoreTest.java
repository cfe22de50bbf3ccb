package com.funnelanalytics.infrastructure.persistence;

import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelMetrics;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsRepository;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsUpsertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaFunnelMetricsStoreTest {

    private static final UUID FUNNEL_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T23:59:59Z");

    @Mock
    private FunnelMetricsRepository metricsRepository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PreparedStatement preparedStatement;

    private JpaFunnelMetricsStore metricsStore;

    @BeforeEach
    void setUp() {
        metricsStore = new JpaFunnelMetricsStore(metricsRepository, new FunnelMetricsUpsertRepository(jdbcTemplate));
    }

    @Test
    void testUpsert_LastStepBindsNullAverage() throws Exception {
        // Given
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class))).thenReturn(1);

        // When
        metricsStore.upsert(row("Purchase", 2, null));

        // Then
        ArgumentCaptor<PreparedStatementSetter> setter = ArgumentCaptor.forClass(PreparedStatementSetter.class);
        verify(jdbcTemplate).update(anyString(), setter.capture());
        setter.getValue().setValues(preparedStatement);

        verify(preparedStatement).setString(3, "Purchase");
        verify(preparedStatement).setInt(4, 2);
        verify(preparedStatement).setNull(8, Types.DOUBLE);
        verify(preparedStatement).setString(9, "2024-01-01");
    }

    @Test
    void testUpsert_BindsAverageWhenPresent() throws Exception {
        // Given
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class))).thenReturn(1);

        // When
        metricsStore.upsert(row("Visit", 0, 60.0));

        // Then
        ArgumentCaptor<PreparedStatementSetter> setter = ArgumentCaptor.forClass(PreparedStatementSetter.class);
        verify(jdbcTemplate).update(anyString(), setter.capture());
        setter.getValue().setValues(preparedStatement);

        verify(preparedStatement).setDouble(8, 60.0);
        verify(preparedStatement, never()).setNull(eq(8), anyInt());
    }

    @Test
    void testUpsert_DataAccessFailureIsStorageFailure() {
        // Given
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        assertThrows(StorageFailureException.class, () -> metricsStore.upsert(row("Visit", 0, 60.0)));
    }

    @Test
    void testFindMetrics_WithoutPeriodReadsEveryPeriod() {
        // Given
        FunnelMetricsEntity entity = FunnelMetricsEntity.builder()
                .funnelId(FUNNEL_ID)
                .step("Visit")
                .stepNumber(0)
                .totalCount(10)
                .conversionRate(60.0)
                .dropOffRate(40.0)
                .period("2024-01-01")
                .periodStart(START)
                .periodEnd(END)
                .build();
        when(metricsRepository.findByFunnelIdOrderByPeriodDescStepNumberAsc(FUNNEL_ID)).thenReturn(List.of(entity));

        // When
        List<FunnelMetrics> rows = metricsStore.findMetrics(FUNNEL_ID, null);

        // Then
        assertEquals(1, rows.size());
        assertEquals(10, rows.get(0).getTotalCount());
        assertNull(rows.get(0).getAvgTimeToNext());
        verify(metricsRepository, never()).findByFunnelIdAndPeriodOrderByStepNumberAsc(any(), any());
    }

    @Test
    void testFindMetrics_DataAccessFailureIsStorageFailure() {
        // Given
        when(metricsRepository.findByFunnelIdAndPeriodOrderByStepNumberAsc(FUNNEL_ID, "2024-01-01"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        assertThrows(StorageFailureException.class, () -> metricsStore.findMetrics(FUNNEL_ID, "2024-01-01"));
    }

    private static FunnelMetrics row(String step, int stepNumber, Double avgTimeToNext) {
        return FunnelMetrics.builder()
                .funnelId(FUNNEL_ID)
                .step(step)
                .stepNumber(stepNumber)
                .totalCount(3)
                .conversionRate(100.0)
                .dropOffRate(0.0)
                .avgTimeToNext(avgTimeToNext)
                .period("2024-01-01")
                .periodStart(START)
                .periodEnd(END)
                .build();
    }
}
