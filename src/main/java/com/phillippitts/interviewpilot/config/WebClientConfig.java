package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.config.properties.EngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * One {@link WebClient} per external subsystem, sharing a connection pool.
 *
 * <p>Response timeouts here are a backstop; each session call is bounded by its own interview timeout.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 20 * 1024 * 1024;

    private final ConnectionProvider provider = ConnectionProvider.builder("interviewpilot-http")
            .maxConnections(100)
            .pendingAcquireTimeout(Duration.ofSeconds(30))
            .build();

    @Bean("transcriptionWebClient")
    public WebClient transcriptionWebClient(EngineProperties properties) {
        return createWebClient(properties.getTranscription());
    }

    @Bean("synthesisWebClient")
    public WebClient synthesisWebClient(EngineProperties properties) {
        return createWebClient(properties.getSynthesis());
    }

    @Bean("scoringWebClient")
    public WebClient scoringWebClient(EngineProperties properties) {
        return createWebClient(properties.getScoring());
    }

    @Bean("planSourceWebClient")
    public WebClient planSourceWebClient(EngineProperties properties) {
        return createWebClient(properties.getPlanSource());
    }

    private WebClient createWebClient(EngineProperties.Endpoint endpoint) {
        HttpClient httpClient = HttpClient.create(provider).responseTimeout(Duration.ofSeconds(60));
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
        return WebClient.builder()
                .baseUrl(endpoint.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
