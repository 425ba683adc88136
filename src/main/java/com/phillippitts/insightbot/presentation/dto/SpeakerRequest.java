package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SpeakerRequest(@NotBlank @Size(max = 100) String displayName) {
}
