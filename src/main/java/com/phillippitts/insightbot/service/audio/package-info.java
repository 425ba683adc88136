/**
 * Per-speaker audio buffering and transient file handling.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.service.audio.SessionRecorder} - concurrent
 *       per-speaker ingestion with atomic flush</li>
 *   <li>{@link com.phillippitts.insightbot.service.audio.AudioFrameWriter} - writes a speaker's
 *       fragments as length-prefixed frames and derives unique file names</li>
 *   <li>{@link com.phillippitts.insightbot.service.audio.AudioMimeTypes} - MIME hints for
 *       uploads</li>
 * </ul>
 *
 * <p>Audio is treated as opaque encoded frames; no decoding or container muxing happens here.
 */
package com.phillippitts.insightbot.service.audio;
