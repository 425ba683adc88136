package com.phillippitts.insightbot;

import com.phillippitts.insightbot.service.session.GuildSessionManager;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(properties = "insightbot.analysis.api-key=")
class InsightBotApplicationTests {

    @Autowired
    private GuildSessionManager sessionManager;

    @Test
    void contextLoads() {
        assertThat(sessionManager.activeSessionCount()).isZero();
    }

}
