package com.phillippitts.insightbot.presentation.dto;

/**
 * Partial settings update; at least one field must be present.
 *
 * @param mode            analysis mode identifier ({@code debate} or {@code summary})
 * @param intervalSeconds seconds between periodic analyses
 */
public record UpdateSettingsRequest(String mode, Long intervalSeconds) {
}
