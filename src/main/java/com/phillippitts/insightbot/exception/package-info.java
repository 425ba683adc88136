/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.insightbot.exception.InsightBotException}
 * and are unchecked.
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionAlreadyExistsException} and
 *       {@link com.phillippitts.insightbot.exception.SessionNotFoundException} - rejected
 *       lifecycle requests, reported to the immediate caller</li>
 *   <li>{@link com.phillippitts.insightbot.exception.NoAudioException} - benign empty flush</li>
 *   <li>{@link com.phillippitts.insightbot.exception.AnalysisServiceException} - remote
 *       analysis failures, classified by kind and converted to a typed result by the pipeline</li>
 *   <li>{@link com.phillippitts.insightbot.exception.PublicationException} and
 *       {@link com.phillippitts.insightbot.exception.VoiceCaptureException} - collaborator
 *       failures</li>
 *   <li>{@link com.phillippitts.insightbot.exception.InvalidSettingException} - rejected
 *       settings updates</li>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionCapacityException} - no thread left
 *       for another session loop</li>
 * </ul>
 *
 * <p>REST mapping lives in
 * {@link com.phillippitts.insightbot.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.insightbot.exception;
