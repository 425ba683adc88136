package com.phillippitts.insightbot;

import com.phillippitts.insightbot.config.properties.AnalysisClientProperties;
import com.phillippitts.insightbot.config.properties.PublicationProperties;
import com.phillippitts.insightbot.config.properties.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        AnalysisClientProperties.class,
        PublicationProperties.class
})
public class InsightBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightBotApplication.class, args);
    }

}
