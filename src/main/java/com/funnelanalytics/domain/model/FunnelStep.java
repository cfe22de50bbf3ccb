package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One named step of a funnel. {@code order} is zero-based and contiguous
 * across the funnel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelStep {

    private String name;
    private int order;
    private Map<String, Object> conditions;
}
