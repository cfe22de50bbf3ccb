package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DropOffPoint {

    private String step;
    private int stepNumber;
    private long dropOffCount;
    private double dropOffRate;
}
