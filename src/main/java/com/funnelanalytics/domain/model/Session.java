package com.funnelanalytics.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One session's events inside a single funnel and query window.
 *
 * Events are held ordered by step number, then timestamp. Never persisted.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Session {

    public static final Comparator<FunnelEvent> STEP_ORDER =
            Comparator.comparingInt(FunnelEvent::getStepNumber)
                    .thenComparing(FunnelEvent::getTimestamp);

    private static final Comparator<FunnelEvent> ARRIVAL_ORDER =
            Comparator.comparing(FunnelEvent::getTimestamp)
                    .thenComparingInt(FunnelEvent::getStepNumber);

    private final String sessionId;
    private final List<FunnelEvent> events;

    public Session(String sessionId, List<FunnelEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Session " + sessionId + " has no events");
        }
        this.sessionId = sessionId;
        this.events = events.stream().sorted(STEP_ORDER).toList();
    }

    /**
     * Earliest event of the session; the entry point is not necessarily step 0.
     */
    public FunnelEvent entryEvent() {
        return events.stream().min(ARRIVAL_ORDER).orElseThrow();
    }

    public Instant entryTime() {
        return entryEvent().getTimestamp();
    }

    public int maxStepNumber() {
        return events.get(events.size() - 1).getStepNumber();
    }

    public boolean reached(int stepNumber) {
        return firstTimestampAt(stepNumber).isPresent();
    }

    /**
     * First timestamp recorded at the step; repeated visits count once.
     */
    public Optional<Instant> firstTimestampAt(int stepNumber) {
        for (FunnelEvent event : events) {
            if (event.getStepNumber() == stepNumber) {
                return Optional.of(event.getTimestamp());
            }
            if (event.getStepNumber() > stepNumber) {
                break;
            }
        }
        return Optional.empty();
    }

    public boolean isCompleted(int lastStepNumber) {
        return maxStepNumber() == lastStepNumber;
    }

    /**
     * Seconds from entry until the last step was first reached, if it was.
     */
    public Optional<Double> completionSeconds(int lastStepNumber) {
        if (!isCompleted(lastStepNumber)) {
            return Optional.empty();
        }
        return firstTimestampAt(lastStepNumber)
                .map(completedAt -> secondsBetween(entryTime(), completedAt));
    }

    /**
     * Fractional seconds from {@code from} to {@code to}; late-arriving
     * events never produce a negative duration.
     */
    public static double secondsBetween(Instant from, Instant to) {
        long millis = Duration.between(from, to).toMillis();
        return Math.max(0L, millis) / 1000.0;
    }
}
