package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidInputException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Bucket size for cohort analysis. Keys sort lexicographically in
 * chronological order.
 */
public enum CohortGranularity {

    DAY {
        @Override
        public String cohortKey(LocalDate date) {
            return date.toString();
        }
    },
    WEEK {
        @Override
        public String cohortKey(LocalDate date) {
            return isoWeekKey(date);
        }
    },
    MONTH {
        @Override
        public String cohortKey(LocalDate date) {
            return String.format("%04d-%02d", date.getYear(), date.getMonthValue());
        }
    };

    public abstract String cohortKey(LocalDate date);

    public String cohortKey(Instant instant) {
        return cohortKey(LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * Parses {@code day | week | month}; null or blank means {@link #DAY}.
     */
    public static CohortGranularity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "day" -> DAY;
            case "week" -> WEEK;
            case "month" -> MONTH;
            default -> throw new InvalidInputException(
                    "Unknown cohortBy value: " + value + " (expected day, week or month)");
        };
    }

    /**
     * ISO-8601 week key {@code YYYY-Www}. The Thursday of the date's week
     * decides both the week-based year and the week number.
     */
    static String isoWeekKey(LocalDate date) {
        LocalDate thursday = date.plusDays(DayOfWeek.THURSDAY.getValue() - date.getDayOfWeek().getValue());
        int week = (thursday.getDayOfYear() - 1) / 7 + 1;
        return String.format("%04d-W%02d", thursday.getYear(), week);
    }
}
