package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One audio fragment pushed by the capture bridge.
 *
 * @param speakerId speaker stream id
 * @param audio     base64-encoded fragment
 */
public record FrameRequest(@NotNull Long speakerId, @NotBlank String audio) {
}
