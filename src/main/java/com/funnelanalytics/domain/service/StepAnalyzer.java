package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.StepAnalysis;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Conversion, drop-off and timing per funnel step.
 *
 * A session counts once per step no matter how many events it logged there.
 * Empty populations yield zero rates, never an error.
 */
@Component
public class StepAnalyzer {

    public List<StepAnalysis> analyze(List<FunnelStep> orderedSteps, Collection<Session> sessions) {
        List<StepAnalysis> result = new ArrayList<>(orderedSteps.size());

        for (int i = 0; i < orderedSteps.size(); i++) {
            FunnelStep step = orderedSteps.get(i);
            boolean lastStep = i == orderedSteps.size() - 1;

            long totalUsers = 0;
            long converted = 0;
            double timeToNextSum = 0;
            long timeToNextCount = 0;
            double timeFromStartSum = 0;

            for (Session session : sessions) {
                Optional<Instant> atStep = session.firstTimestampAt(step.getOrder());
                if (atStep.isEmpty()) {
                    continue;
                }
                totalUsers++;
                timeFromStartSum += Session.secondsBetween(session.entryTime(), atStep.get());

                if (!lastStep) {
                    Optional<Instant> atNext = session.firstTimestampAt(orderedSteps.get(i + 1).getOrder());
                    if (atNext.isPresent()) {
                        converted++;
                        timeToNextSum += Session.secondsBetween(atStep.get(), atNext.get());
                        timeToNextCount++;
                    }
                }
            }

            double conversionRate = lastStep ? 100.0 : percentage(converted, totalUsers);
            double dropOffRate = lastStep ? 0.0 : 100.0 - conversionRate;

            result.add(StepAnalysis.builder()
                    .step(step.getName())
                    .stepNumber(step.getOrder())
                    .totalUsers(totalUsers)
                    .droppedUsers(lastStep ? 0 : totalUsers - converted)
                    .conversionRate(conversionRate)
                    .dropOffRate(dropOffRate)
                    .avgTimeToNext(timeToNextCount > 0 ? timeToNextSum / timeToNextCount : null)
                    .avgTimeFromStart(totalUsers > 0 ? timeFromStartSum / totalUsers : 0.0)
                    .build());
        }

        return result;
    }

    static double percentage(long part, long whole) {
        return whole > 0 ? 100.0 * part / whole : 0.0;
    }
}
