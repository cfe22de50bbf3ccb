package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.IsoFields;

import static org.junit.jupiter.api.Assertions.*;

class CohortGranularityTest {

    @ParameterizedTest
    @CsvSource({
            "2020-12-29, 2020-W53",
            "2020-12-31, 2020-W53",
            "2021-01-03, 2020-W53",
            "2021-01-04, 2021-W01",
            "2024-12-29, 2024-W52",
            "2024-12-30, 2025-W01",
            "2025-01-01, 2025-W01",
            "2025-01-04, 2025-W01",
            "2025-12-29, 2026-W01",
            "2026-01-04, 2026-W01",
            "2027-01-01, 2026-W53",
            "2024-01-01, 2024-W01"
    })
    void testIsoWeekKey_YearBoundaries(String date, String expected) {
        assertEquals(expected, CohortGranularity.WEEK.cohortKey(LocalDate.parse(date)));
    }

    @Test
    void testIsoWeekKey_MatchesJdkIsoFieldsForFiveYears() {
        LocalDate date = LocalDate.of(2022, 1, 1);
        while (date.getYear() < 2027) {
            String expected = String.format("%04d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            assertEquals(expected, CohortGranularity.isoWeekKey(date), date.toString());
            date = date.plusDays(1);
        }
    }

    @Test
    void testCohortKey_UsesUtcDate() {
        Instant instant = Instant.parse("2024-03-31T23:30:00Z");

        assertEquals("2024-03-31", CohortGranularity.DAY.cohortKey(instant));
        assertEquals("2024-03", CohortGranularity.MONTH.cohortKey(instant));
    }

    @Test
    void testFromValue() {
        assertEquals(CohortGranularity.DAY, CohortGranularity.fromValue(null));
        assertEquals(CohortGranularity.DAY, CohortGranularity.fromValue(""));
        assertEquals(CohortGranularity.WEEK, CohortGranularity.fromValue("week"));
        assertEquals(CohortGranularity.MONTH, CohortGranularity.fromValue("MONTH"));
        assertThrows(InvalidInputException.class, () -> CohortGranularity.fromValue("quarter"));
    }
}
