package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion metrics for sessions sharing one value of a metadata field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentData {

    public static final String UNKNOWN_SEGMENT = "Unknown";
    public static final String NO_DROP_OFF = "None";

    private String segment;
    private long totalUsers;
    private double completionRate;
    private double avgCompletionTime;
    private String topDropOffStep;
}
