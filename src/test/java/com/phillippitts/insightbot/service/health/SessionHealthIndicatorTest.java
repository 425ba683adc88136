package com.phillippitts.insightbot.service.health;

import com.phillippitts.insightbot.service.analysis.AnalysisClient;
import com.phillippitts.insightbot.service.session.GuildSessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionHealthIndicatorTest {

    private final GuildSessionManager manager = mock(GuildSessionManager.class);
    private final AnalysisClient client = mock(AnalysisClient.class);

    @Test
    void upWhenAnalysisClientConfigured() {
        when(client.isConfigured()).thenReturn(true);
        when(manager.activeSessionCount()).thenReturn(2);

        Health health = new SessionHealthIndicator(manager, client).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("activeSessions", 2);
    }

    @Test
    void degradedWithoutApiKey() {
        when(client.isConfigured()).thenReturn(false);

        Health health = new SessionHealthIndicator(manager, client).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("analysisClient", "missing api key");
    }
}
