package com.phillippitts.insightbot.service.session.event;

import com.phillippitts.insightbot.domain.AnalysisResult;

import java.time.Instant;

/**
 * Emitted after a stopped session ran its final analysis and released its resources.
 *
 * @param guildId     guild of the session
 * @param finalStatus outcome of the final analysis
 * @param stoppedAt   when the stop sequence finished
 */
public record SessionStoppedEvent(long guildId, AnalysisResult.Status finalStatus, Instant stoppedAt) {
}
