package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.domain.model.FunnelMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;

/**
 * Idempotent write path for materialized metrics.
 *
 * Relies on the database's ON CONFLICT atomicity, so concurrent writers of
 * the same (funnel_id, step, period) end up last-writer-wins. id and
 * created_at of an existing row are preserved.
 */
@Repository
@RequiredArgsConstructor
public class FunnelMetricsUpsertRepository {

    private static final String UPSERT_SQL = """
            INSERT INTO funnel_metrics(
                id, funnel_id, step, step_number, total_count, conversion_rate, drop_off_rate,
                avg_time_to_next, period, period_start, period_end, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (funnel_id, step, period)
            DO UPDATE SET step_number = EXCLUDED.step_number,
                          total_count = EXCLUDED.total_count,
                          conversion_rate = EXCLUDED.conversion_rate,
                          drop_off_rate = EXCLUDED.drop_off_rate,
                          avg_time_to_next = EXCLUDED.avg_time_to_next,
                          period_start = EXCLUDED.period_start,
                          period_end = EXCLUDED.period_end
            """;

    private final JdbcTemplate jdbcTemplate;

    public int upsert(FunnelMetrics metrics) {
        return jdbcTemplate.update(UPSERT_SQL, ps -> {
            ps.setObject(1, UUID.randomUUID());
            ps.setObject(2, metrics.getFunnelId());
            ps.setString(3, metrics.getStep());
            ps.setInt(4, metrics.getStepNumber());
            ps.setLong(5, metrics.getTotalCount());
            ps.setDouble(6, metrics.getConversionRate());
            ps.setDouble(7, metrics.getDropOffRate());
            if (metrics.getAvgTimeToNext() != null) {
                ps.setDouble(8, metrics.getAvgTimeToNext());
            } else {
                ps.setNull(8, Types.DOUBLE);
            }
            ps.setString(9, metrics.getPeriod());
            ps.setTimestamp(10, Timestamp.from(metrics.getPeriodStart()));
            ps.setTimestamp(11, Timestamp.from(metrics.getPeriodEnd()));
            ps.setTimestamp(12, Timestamp.from(Instant.now()));
        });
    }
}
