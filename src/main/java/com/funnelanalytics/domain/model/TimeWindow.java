package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidInputException;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Closed interval {@code [start, end]} of event timestamps.
 */
@Value
public class TimeWindow {

    private static final DateTimeFormatter PERIOD_FORMAT =
            DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    Instant start;
    Instant end;

    public static TimeWindow of(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidInputException("Time window requires both start and end");
        }
        if (start.isAfter(end)) {
            throw new InvalidInputException(
                    "Time window start " + start + " is after end " + end);
        }
        return new TimeWindow(start, end);
    }

    /**
     * Fills in missing bounds: end defaults to now, start to {@code defaultDays}
     * before end.
     */
    public static TimeWindow resolve(Instant start, Instant end, Clock clock, int defaultDays) {
        Instant resolvedEnd = end != null ? end : clock.instant();
        Instant resolvedStart = start != null ? start : resolvedEnd.minus(Duration.ofDays(defaultDays));
        return of(resolvedStart, resolvedEnd);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    /**
     * Canonical period key: the window's start date in UTC, {@code YYYY-MM-DD}.
     */
    public String periodKey() {
        return PERIOD_FORMAT.format(start);
    }
}
