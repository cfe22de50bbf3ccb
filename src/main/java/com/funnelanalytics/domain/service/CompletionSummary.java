package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.model.Session;
import lombok.Value;

import java.util.Collection;
import java.util.Optional;

/**
 * Completion counts and timing over a group of sessions. A session is
 * completed when the highest step it reached is the funnel's last step.
 */
@Value
class CompletionSummary {

    long totalUsers;
    long completedUsers;
    double completionRate;
    double avgCompletionTime;

    static CompletionSummary of(Collection<Session> sessions, int lastStepNumber) {
        long completed = 0;
        double completionSeconds = 0;

        for (Session session : sessions) {
            Optional<Double> seconds = session.completionSeconds(lastStepNumber);
            if (seconds.isPresent()) {
                completed++;
                completionSeconds += seconds.get();
            }
        }

        long total = sessions.size();
        return new CompletionSummary(
                total,
                completed,
                StepAnalyzer.percentage(completed, total),
                completed > 0 ? completionSeconds / completed : 0.0);
    }
}
