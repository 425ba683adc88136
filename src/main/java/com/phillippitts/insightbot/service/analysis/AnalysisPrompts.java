package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisMode;

/**
 * Instructions sent ahead of the audio in every analysis request.
 */
public final class AnalysisPrompts {

    /** Answer the model is told to give when the audio holds no meaningful discussion. */
    public static final String NO_NEW_DISCUSSION = "There was no new discussion.";

    static final String DEBATE = """
            You are a professional discussion analyst and fact checker. Analyze the provided audio \
            files (each one is preceded by the name of its speaker) and write a report in the format below.

            Rules:
            1. Attribute every voice to the speaker named before its file.
            2. Verify factual claims made in the discussion (figures, news, events) with the search \
            tool and use the most recent information.
            3. Point out statements that contradict what the same speaker said earlier.
            4. If the audio is silent, contains only noise, or has no meaningful conversation, do not \
            analyze it. Answer only: "%s" Do not invent content.
            5. The previous context is reference material only. Never include statements in the report \
            that are not in the audio provided this time.

            Sections:
            [Summary]: (at most 300 words)
            [Positions]: (speaker name: for / against / neutral, and their main points)
            [Points of conflict]: (what is blocking agreement)
            [Contradictions and fact check]: (inconsistent statements and claims that disagree with \
            current information)
            [Compromise]: (a proposal that could resolve the conflict)
            """.formatted(NO_NEW_DISCUSSION);

    static final String SUMMARY = """
            You are the secretary of a meeting. Analyze the provided audio files and write a friendly \
            summary that lets someone who joined late understand where the conversation stands.

            Rules:
            1. Make clear who is talking about what.
            2. Add a short explanation to jargon and context-dependent terms.
            3. If the audio is silent, contains only noise, or has no meaningful conversation, do not \
            analyze it. Answer only: "%s"
            4. The previous context is reference material only. Never include statements in the report \
            that are not in the audio provided this time.

            Sections:
            [Current topic]: (a few plain lines)
            [How we got here]: (main statements and decisions, in order, as bullet points)
            [Open issues]: (what is still undecided, what should be discussed next)
            [Participants]: (the main point of each participant)
            """.formatted(NO_NEW_DISCUSSION);

    private AnalysisPrompts() {
    }

    public static String forMode(AnalysisMode mode) {
        return switch (mode) {
            case DEBATE -> DEBATE;
            case SUMMARY -> SUMMARY;
        };
    }

    /**
     * Preamble that carries the previous report into the next request.
     */
    public static String contextPreamble(String context) {
        return "Previous context:\n" + context + "\n---\nCurrent discussion:";
    }

    public static String speakerLabel(String displayName) {
        return "Speaker: " + displayName;
    }
}
