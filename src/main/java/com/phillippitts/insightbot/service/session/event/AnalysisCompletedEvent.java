package com.phillippitts.insightbot.service.session.event;

import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.service.session.AnalysisTrigger;

import java.time.Instant;

/**
 * Emitted after every analysis run, whatever its outcome.
 *
 * @param guildId       guild of the session
 * @param result        classified outcome
 * @param trigger       what started the run
 * @param durationNanos time from flush to publication
 * @param completedAt   when the run finished
 */
public record AnalysisCompletedEvent(
        long guildId,
        AnalysisResult result,
        AnalysisTrigger trigger,
        long durationNanos,
        Instant completedAt
) {

    public boolean isFinal() {
        return trigger == AnalysisTrigger.FINAL;
    }

    public boolean isManual() {
        return trigger == AnalysisTrigger.MANUAL;
    }
}
