package com.phillippitts.insightbot.service.session;

import java.util.Locale;

/**
 * What started an analysis run.
 */
public enum AnalysisTrigger {
    PERIODIC,
    MANUAL,
    FINAL;

    /** Lower-case name used as a metric tag. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
