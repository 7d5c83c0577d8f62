package com.rde.ingestion.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class RedditClientConfig {

    @Bean
    @Qualifier("redditApiWebClient")
    WebClient redditApiWebClient(RedditProperties properties) {
        String baseUrl = properties.hasCredentials() ? properties.getApiBaseUrl() : properties.getPublicBaseUrl();
        return WebClient.builder()
            .baseUrl(baseUrl)
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("Accept", "application/json")
            .exchangeStrategies(strategies(properties))
            .build();
    }

    @Bean
    @Qualifier("redditAuthWebClient")
    WebClient redditAuthWebClient(RedditProperties properties) {
        return WebClient.builder()
            .baseUrl(properties.getAuthBaseUrl())
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("Accept", "application/json")
            .exchangeStrategies(strategies(properties))
            .build();
    }

    private ExchangeStrategies strategies(RedditProperties properties) {
        int maxBytes = Math.max(1, properties.getMaxInMemoryMb()) * 1024 * 1024;
        return ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
    }
}
