package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.service.publication.MessageChunker;
import com.phillippitts.insightbot.util.TimeUtils;

import java.time.Instant;
import java.util.List;

/**
 * User-visible texts of a published analysis.
 */
public final class ReportMessages {

    public static final String FALLBACK_REPORT = "The analysis result could not be retrieved.";
    public static final String RATE_LIMIT_ADVISORY =
            "⚠️ The analysis request quota has been reached. The next scheduled run will try again.";
    public static final String ERROR_PREFIX = "An error occurred during analysis: ";
    public static final String REPORT_HEADER = "📊 **Discussion report**\n";
    public static final String FINAL_REPORT_HEADER = "🏁 **Final report**\n";

    private ReportMessages() {
    }

    /** Channel message the report thread hangs off. */
    public static String starter(boolean isFinal, Instant at) {
        String ts = TimeUtils.reportTimestamp(at);
        return isFinal ? "🛑 **Session ended** (" + ts + ")" : "📅 **Scheduled analysis** (" + ts + ")";
    }

    /** First message in the thread, sent while the report is being generated. */
    public static String progress(AnalysisMode mode) {
        return "🔄 Analyzing audio files... (Mode: " + mode.value() + ")";
    }

    public static String threadTitle(boolean isFinal, Instant at) {
        String ts = TimeUtils.reportTimestamp(at);
        return isFinal ? "Discussion report (final) " + ts : "Discussion report " + ts;
    }

    /**
     * Messages to post into the report thread for a result, in send order.
     *
     * @return empty for {@link AnalysisResult.Status#NO_AUDIO}
     */
    public static List<String> threadMessages(AnalysisResult result, boolean isFinal, int messageLimit, int chunkSize) {
        return switch (result.status()) {
            case SUCCESS -> MessageChunker.layout(isFinal ? FINAL_REPORT_HEADER : REPORT_HEADER,
                    result.report(), messageLimit, chunkSize);
            case RATE_LIMITED -> List.of(RATE_LIMIT_ADVISORY);
            case TRANSIENT_ERROR -> MessageChunker.chunk(ERROR_PREFIX + result.message(), chunkSize);
            case NO_AUDIO -> List.of();
        };
    }
}
