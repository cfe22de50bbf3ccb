package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-step conversion and timing statistics.
 *
 * Rates are percentages in {@code [0, 100]}. {@code avgTimeToNext} is null on
 * the last step and when no session moved on to the next step.
 * {@code droppedUsers} counts sessions at this step that never reached the
 * next one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepAnalysis {

    private String step;
    private int stepNumber;
    private long totalUsers;
    private long droppedUsers;
    private double conversionRate;
    private double dropOffRate;
    private Double avgTimeToNext;
    private double avgTimeFromStart;
}
