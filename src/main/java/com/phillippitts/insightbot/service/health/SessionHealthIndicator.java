package com.phillippitts.insightbot.service.health;

import com.phillippitts.insightbot.service.analysis.AnalysisClient;
import com.phillippitts.insightbot.service.session.GuildSessionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for session orchestration.
 *
 * <ul>
 *   <li>UP: the analysis client has credentials</li>
 *   <li>DEGRADED: no credentials; sessions record but every analysis fails</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final GuildSessionManager sessionManager;
    private final AnalysisClient analysisClient;

    public SessionHealthIndicator(GuildSessionManager sessionManager, AnalysisClient analysisClient) {
        this.sessionManager = sessionManager;
        this.analysisClient = analysisClient;
    }

    @Override
    public Health health() {
        boolean configured = analysisClient.isConfigured();
        Health.Builder builder = configured ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("activeSessions", sessionManager.activeSessionCount())
                .withDetail("analysisClient", configured ? "configured" : "missing api key")
                .build();
    }
}
