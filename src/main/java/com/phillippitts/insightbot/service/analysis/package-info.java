/**
 * Upload, analysis and report publication of flushed audio.
 *
 * <p>{@link com.phillippitts.insightbot.service.analysis.AnalysisPipeline} turns every failure
 * into a typed {@link com.phillippitts.insightbot.domain.AnalysisResult}; the remote service is
 * reached through {@link com.phillippitts.insightbot.service.analysis.AnalysisClient}.
 */
package com.phillippitts.insightbot.service.analysis;
