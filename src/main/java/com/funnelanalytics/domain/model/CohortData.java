package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortData {

    private String cohortDate;
    private long totalUsers;
    private long completedUsers;
    private double completionRate;
    private double avgCompletionTime;
}
