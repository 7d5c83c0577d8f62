package com.rde.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.rde.ingestion.config.RedditProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Holds the OAuth bearer token for the Reddit API and renews it shortly before it expires.
 * Without a configured client id the provider stays anonymous and never yields a token.
 */
@Component
public class RedditTokenProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedditTokenProvider.class);

    private final WebClient redditAuthWebClient;
    private final RedditProperties properties;
    private final Clock clock;
    private final AtomicReference<AccessToken> current = new AtomicReference<>();

    public RedditTokenProvider(
        @Qualifier("redditAuthWebClient") WebClient redditAuthWebClient,
        RedditProperties properties,
        Clock clock
    ) {
        this.redditAuthWebClient = redditAuthWebClient;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isAnonymous() {
        return !properties.hasCredentials();
    }

    /**
     * Emits a valid bearer token, requesting a new one when none is cached or the cached one is
     * about to expire. Completes empty in anonymous mode.
     */
    public Mono<String> bearerToken() {
        if (isAnonymous()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            Instant now = clock.instant();
            AccessToken cached = current.get();
            Duration skew = Duration.ofSeconds(properties.getTokenRefreshSkewSeconds());
            if (cached != null && now.plus(skew).isBefore(cached.expiresAt())) {
                return Mono.just(cached.value());
            }
            return requestToken(now)
                .doOnNext(token -> {
                    current.set(token);
                    LOGGER.info("Obtained Reddit access token valid until {}", token.expiresAt());
                })
                .map(AccessToken::value);
        });
    }

    public void invalidate() {
        current.set(null);
    }

    private Mono<AccessToken> requestToken(Instant now) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (properties.usesPasswordGrant()) {
            form.add("grant_type", "password");
            form.add("username", properties.getUsername());
            form.add("password", properties.getPassword());
        } else {
            form.add("grant_type", "client_credentials");
        }

        return redditAuthWebClient.post()
            .uri("/api/v1/access_token")
            .headers(headers -> headers.setBasicAuth(
                properties.getClientId(),
                properties.getClientSecret() == null ? "" : properties.getClientSecret()
            ))
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData(form))
            .exchangeToMono(response -> {
                HttpStatusCode status = response.statusCode();
                if (status.is2xxSuccessful()) {
                    return response.bodyToMono(JsonNode.class);
                }
                return response.releaseBody().then(Mono.<JsonNode>error(tokenFailure(status.value())));
            })
            .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .onErrorMap(TimeoutException.class,
                ex -> new TransientSourceException("Token request timed out", ex))
            .onErrorMap(WebClientRequestException.class,
                ex -> new TransientSourceException("Token endpoint unreachable: " + ex.getMessage(), ex))
            .switchIfEmpty(Mono.error(() -> new SourceAuthException("Reddit token endpoint returned no body")))
            .flatMap(body -> {
                if (body.hasNonNull("error") || !body.hasNonNull("access_token")) {
                    String reason = body.path("error").asText("missing access_token");
                    return Mono.error(new SourceAuthException("Reddit rejected credentials: " + reason));
                }
                long expiresIn = body.path("expires_in").asLong(3600);
                return Mono.just(new AccessToken(body.path("access_token").asText(), now.plusSeconds(expiresIn)));
            });
    }

    private SourceException tokenFailure(int status) {
        if (status == 400 || status == 401 || status == 403) {
            return new SourceAuthException("Reddit token endpoint returned HTTP " + status);
        }
        if (status == 429) {
            return new RateLimitedException(
                "Reddit token endpoint rate limited",
                Duration.ofMillis(properties.getDefaultRateLimitDelayMs())
            );
        }
        return new TransientSourceException("Reddit token endpoint returned HTTP " + status, status >= 500);
    }

    private record AccessToken(String value, Instant expiresAt) {
    }
}
