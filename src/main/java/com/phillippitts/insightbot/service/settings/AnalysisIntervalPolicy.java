package com.phillippitts.insightbot.service.settings;

import java.time.Duration;

/**
 * Interval re-evaluation point of the periodic analysis loop.
 *
 * <p>The loop asks for the interval once per iteration, right before it sleeps. A setting
 * changed while the loop is asleep therefore applies from the following cycle on; the
 * current sleep is not shortened or extended.
 */
@FunctionalInterface
public interface AnalysisIntervalPolicy {

    /**
     * @return the interval to wait before the next periodic analysis of the guild; positive
     */
    Duration currentInterval(long guildId);
}
