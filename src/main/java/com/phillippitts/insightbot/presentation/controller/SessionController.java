package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.exception.SessionNotFoundException;
import com.phillippitts.insightbot.presentation.dto.AnalysisResponse;
import com.phillippitts.insightbot.presentation.dto.SessionView;
import com.phillippitts.insightbot.presentation.dto.StartSessionRequest;
import com.phillippitts.insightbot.service.session.GuildSession;
import com.phillippitts.insightbot.service.session.GuildSessionManager;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Session lifecycle endpoints, the REST counterpart of the start, stop and analyze commands.
 */
@RestController
@RequestMapping("/api/guilds/{guildId}/session")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final GuildSessionManager sessionManager;

    SessionController(GuildSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @PostMapping
    ResponseEntity<SessionView> start(@PathVariable long guildId, @Valid @RequestBody StartSessionRequest request) {
        GuildSession session = sessionManager.startSession(guildId, request.textChannelId(), request.voiceChannelId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(session));
    }

    @GetMapping
    SessionView get(@PathVariable long guildId) {
        return sessionManager.findSession(guildId)
                .map(SessionView::of)
                .orElseThrow(() -> new SessionNotFoundException(guildId));
    }

    /**
     * Stops the session; the final analysis continues in the background.
     */
    @DeleteMapping
    ResponseEntity<Map<String, Object>> stop(@PathVariable long guildId) {
        sessionManager.stopSession(guildId).whenComplete((result, error) -> {
            if (error != null) {
                LOG.error("Stop sequence for guild {} failed", guildId, error);
            }
        });
        return ResponseEntity.accepted().body(Map.of(
                "guildId", guildId,
                "status", "stopping"
        ));
    }

    /**
     * Runs an analysis now and answers once it completed. Nothing is posted to the channel when
     * no audio was recorded.
     */
    @PostMapping("/analysis")
    CompletableFuture<AnalysisResponse> analyze(@PathVariable long guildId) {
        return sessionManager.analyzeNow(guildId).thenApply(AnalysisResponse::of);
    }
}
