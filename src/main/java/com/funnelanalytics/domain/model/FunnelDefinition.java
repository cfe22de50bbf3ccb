package com.funnelanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of a funnel definition owned by one account.
 */
@Value
@Builder
public class FunnelDefinition {

    UUID id;
    UUID ownerId;
    String name;
    String description;
    List<FunnelStep> steps;
    boolean trackingEnabled;
    Map<String, Object> metadata;

    /**
     * Steps sorted by {@code order}, whatever order they were stored in.
     */
    public List<FunnelStep> orderedSteps() {
        if (steps == null) {
            return List.of();
        }
        return steps.stream()
                .sorted(Comparator.comparingInt(FunnelStep::getOrder))
                .toList();
    }

    /**
     * Order of the final step, or -1 for a funnel without steps.
     */
    public int lastStepNumber() {
        List<FunnelStep> ordered = orderedSteps();
        return ordered.isEmpty() ? -1 : ordered.get(ordered.size() - 1).getOrder();
    }

    public Optional<FunnelStep> stepAt(int stepNumber) {
        return orderedSteps().stream()
                .filter(step -> step.getOrder() == stepNumber)
                .findFirst();
    }
}
