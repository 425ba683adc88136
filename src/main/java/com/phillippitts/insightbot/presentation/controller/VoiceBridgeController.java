package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.exception.SessionNotFoundException;
import com.phillippitts.insightbot.presentation.dto.FrameRequest;
import com.phillippitts.insightbot.presentation.dto.SpeakerRequest;
import com.phillippitts.insightbot.service.audio.AudioFrameWriter;
import com.phillippitts.insightbot.service.capture.BridgedVoiceCaptureService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;

/**
 * Intake for the external capture bridge: audio fragments and speaker names.
 * Both are rejected with 404 unless the guild has an open capture; fragments the frame file
 * cannot represent are rejected with 400.
 */
@RestController
@RequestMapping("/api/guilds/{guildId}/voice")
class VoiceBridgeController {

    private final BridgedVoiceCaptureService captureService;

    VoiceBridgeController(BridgedVoiceCaptureService captureService) {
        this.captureService = captureService;
    }

    @PostMapping("/frames")
    ResponseEntity<Void> frame(@PathVariable long guildId, @Valid @RequestBody FrameRequest request) {
        byte[] fragment = Base64.getDecoder().decode(request.audio());
        if (fragment.length > AudioFrameWriter.MAX_FRAGMENT_BYTES) {
            throw new IllegalArgumentException("Fragment of " + fragment.length + " bytes exceeds "
                    + AudioFrameWriter.MAX_FRAGMENT_BYTES);
        }
        if (!captureService.deliverFragment(guildId, request.speakerId(), fragment)) {
            throw new SessionNotFoundException(guildId);
        }
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/speakers/{speakerId}")
    ResponseEntity<Void> speaker(@PathVariable long guildId,
                                 @PathVariable long speakerId,
                                 @Valid @RequestBody SpeakerRequest request) {
        if (!captureService.identifySpeaker(guildId, speakerId, request.displayName())) {
            throw new SessionNotFoundException(guildId);
        }
        return ResponseEntity.noContent().build();
    }
}
