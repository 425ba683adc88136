package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.config.properties.AnalysisClientProperties;
import com.phillippitts.insightbot.config.properties.PublicationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP clients for the remote analysis service and the messaging API.
 *
 * <p>Every client has bounded connect and read timeouts so a stuck remote call cannot hold a
 * session loop indefinitely.
 */
@Configuration
public class ClientConfig {

    @Bean
    RestClient analysisRestClient(AnalysisClientProperties properties) {
        return RestClient.builder()
            .requestFactory(requestFactory(properties.getConnectTimeout(), properties.getReadTimeout()))
            .build();
    }

    @Bean
    RestClient publicationRestClient(PublicationProperties properties) {
        return RestClient.builder()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + properties.getBotToken())
            .requestFactory(requestFactory(Duration.ofSeconds(10), Duration.ofSeconds(30)))
            .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connect.toMillis());
        factory.setReadTimeout((int) read.toMillis());
        return factory;
    }
}
