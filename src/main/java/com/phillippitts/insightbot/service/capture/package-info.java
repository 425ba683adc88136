/**
 * Voice capture seam.
 *
 * <p>{@link com.phillippitts.insightbot.service.capture.VoiceCaptureService} hands out
 * {@link com.phillippitts.insightbot.service.capture.VoiceCaptureHandle}s; captured fragments
 * flow into an {@link com.phillippitts.insightbot.service.capture.AudioFrameSink} owned by the
 * guild session.
 */
package com.phillippitts.insightbot.service.capture;
