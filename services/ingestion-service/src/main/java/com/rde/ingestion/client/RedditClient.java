package com.rde.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.rde.ingestion.config.RedditProperties;
import com.rde.ingestion.domain.RawItem;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class RedditClient implements SourceClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedditClient.class);

    private final WebClient redditApiWebClient;
    private final RedditTokenProvider tokenProvider;
    private final RedditProperties properties;

    public RedditClient(
        @Qualifier("redditApiWebClient") WebClient redditApiWebClient,
        RedditTokenProvider tokenProvider,
        RedditProperties properties
    ) {
        this.redditApiWebClient = redditApiWebClient;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
    }

    @Override
    public FetchResult fetch(String source, ListingType listing, int limit) {
        try {
            JsonNode root = requestListing(source, listing, limit, true)
                .retryWhen(transientRetry(source, listing))
                .block();
            List<RawItem> items = parseListing(root, source, listing);
            LOGGER.debug("Fetched {} {} items from r/{}", items.size(), listing.path(), source);
            return FetchResult.success(items);
        } catch (RateLimitedException ex) {
            LOGGER.warn("Rate limited on r/{} ({}), retry after {}", source, listing.path(), ex.getRetryAfter());
            return FetchResult.rateLimited(ex.getRetryAfter(), ex.getMessage());
        } catch (SourceAuthException ex) {
            LOGGER.error("Authentication failed for r/{}: {}", source, ex.getMessage());
            return FetchResult.authError(ex.getMessage());
        } catch (TransientSourceException ex) {
            LOGGER.warn("Giving up on r/{} ({}) this cycle: {}", source, listing.path(), ex.getMessage());
            return FetchResult.transientError(ex.getMessage());
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            LOGGER.warn("Unexpected failure fetching r/{}: {}", source, cause.toString());
            return FetchResult.transientError(cause.getMessage() == null ? cause.toString() : cause.getMessage());
        }
    }

    private Mono<JsonNode> requestListing(String source, ListingType listing, int limit, boolean allowRenewal) {
        return tokenProvider.bearerToken()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(token -> {
                String path = token.isPresent()
                    ? "/r/" + source + "/" + listing.path()
                    : "/r/" + source + "/" + listing.path() + ".json";
                return redditApiWebClient.get()
                    .uri(uriBuilder -> uriBuilder.path(path)
                        .queryParam("limit", Math.max(1, Math.min(limit, 100)))
                        .queryParam("raw_json", 1)
                        .build())
                    .headers(headers -> token.ifPresent(headers::setBearerAuth))
                    .exchangeToMono(response -> handleResponse(response, source, token.isPresent()));
            })
            .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .onErrorMap(TimeoutException.class,
                ex -> new TransientSourceException("Request to r/" + source + " timed out", ex))
            .onErrorMap(WebClientRequestException.class,
                ex -> new TransientSourceException("Request to r/" + source + " failed: " + ex.getMessage(), ex))
            .onErrorResume(TokenRejectedException.class, ex -> {
                if (!allowRenewal) {
                    return Mono.error(new SourceAuthException("Reddit rejected a freshly issued token for r/" + source));
                }
                LOGGER.info("Access token rejected, renewing");
                tokenProvider.invalidate();
                return requestListing(source, listing, limit, false);
            });
    }

    private Mono<JsonNode> handleResponse(ClientResponse response, String source, boolean authenticated) {
        int status = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(JsonNode.class);
        }
        SourceException failure;
        if (status == 429) {
            failure = new RateLimitedException("HTTP 429 from r/" + source, retryAfter(response.headers().asHttpHeaders()));
        } else if (status == 401 && authenticated) {
            failure = new TokenRejectedException();
        } else if (status == 401 || status == 403) {
            failure = new SourceAuthException("HTTP " + status + " from r/" + source);
        } else if (status >= 500) {
            failure = new TransientSourceException("HTTP " + status + " from r/" + source, true);
        } else {
            failure = new TransientSourceException("HTTP " + status + " from r/" + source, false);
        }
        return response.releaseBody().then(Mono.error(failure));
    }

    private Retry transientRetry(String source, ListingType listing) {
        RedditProperties.Retry retry = properties.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofMillis(retry.getBaseDelayMs()))
            .maxBackoff(Duration.ofMillis(retry.getMaxDelayMs()))
            .jitter(retry.getJitter())
            .filter(ex -> ex instanceof TransientSourceException transientEx && transientEx.isRetryable())
            .doBeforeRetry(signal -> LOGGER.debug(
                "Retrying r/{} ({}) attempt {} after: {}",
                source, listing.path(), signal.totalRetries() + 1, signal.failure().getMessage()))
            .onRetryExhaustedThrow((retrySpec, signal) -> new TransientSourceException(
                "Exhausted " + retry.getMaxAttempts() + " retries: " + signal.failure().getMessage(),
                signal.failure()));
    }

    Duration retryAfter(HttpHeaders headers) {
        Duration fromHeader = parseSeconds(headers.getFirst(HttpHeaders.RETRY_AFTER));
        if (fromHeader == null) {
            fromHeader = parseSeconds(headers.getFirst("X-Ratelimit-Reset"));
        }
        return fromHeader == null ? Duration.ofMillis(properties.getDefaultRateLimitDelayMs()) : fromHeader;
    }

    private Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            return seconds < 0 ? null : Duration.ofMillis((long) Math.ceil(seconds * 1000));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    List<RawItem> parseListing(JsonNode root, String source, ListingType listing) {
        if (root == null) {
            return List.of();
        }
        JsonNode children = root.path("data").path("children");
        List<RawItem> items = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode data = child.path("data");
            String id = text(data.get("id"));
            if (id.isBlank()) {
                continue;
            }
            boolean stickied = data.path("stickied").asBoolean(false);
            if (stickied && listing.skipsStickied()) {
                continue;
            }
            // Reddit echoes its own capitalization; keep the configured name so stats stay keyed.
            items.add(new RawItem(
                id,
                source,
                text(data.get("title")),
                text(data.get("selftext")),
                text(data.get("author")),
                data.path("score").asInt(0),
                data.path("num_comments").asInt(0),
                createdAt(data.get("created_utc")),
                text(data.get("permalink")),
                text(data.get("url")),
                data.path("upvote_ratio").asDouble(0.0),
                data.hasNonNull("link_flair_text") ? data.get("link_flair_text").asText() : null,
                stickied,
                data.path("over_18").asBoolean(false)
            ));
        }
        return items;
    }

    private Instant createdAt(JsonNode node) {
        if (node == null || node.isNull() || !node.isNumber()) {
            return null;
        }
        return Instant.ofEpochMilli(Math.round(node.asDouble() * 1000));
    }

    private String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }

    private static final class TokenRejectedException extends SourceException {

        private TokenRejectedException() {
            super("Access token rejected");
        }
    }
}
