package com.rde.ingestion.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.config.RedditProperties;
import com.rde.ingestion.domain.RawItem;
import com.rde.ingestion.service.Aggregator;
import com.rde.ingestion.service.ItemAnalyzer;
import com.rde.ingestion.support.MutableClock;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

class RedditClientTest {

    private static final String LISTING = """
        {"kind": "Listing", "data": {"children": [
          {"kind": "t3", "data": {"id": "abc", "subreddit": "stocks", "title": "AAPL earnings beat",
            "selftext": "numbers inside", "author": "someone", "score": 120, "num_comments": 30,
            "created_utc": 1700000000.0, "permalink": "/r/stocks/comments/abc/aapl_earnings_beat/",
            "url": "https://www.reddit.com/r/stocks/comments/abc/", "upvote_ratio": 0.95,
            "link_flair_text": "DD", "stickied": false, "over_18": false}},
          {"kind": "t3", "data": {"id": "pin", "subreddit": "stocks", "title": "Daily thread",
            "selftext": "", "author": "AutoModerator", "score": 10, "num_comments": 500,
            "created_utc": 1699990000, "permalink": "/r/stocks/comments/pin/daily/", "stickied": true}},
          {"kind": "t3", "data": {"title": "no id"}}
        ]}}
        """;

    private HttpServer server;
    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private RedditProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::dispatch);
        server.start();

        properties = new RedditProperties();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        properties.setApiBaseUrl(baseUrl);
        properties.setAuthBaseUrl(baseUrl);
        properties.setPublicBaseUrl(baseUrl);
        properties.setRequestTimeoutMs(5_000);
        properties.setDefaultRateLimitDelayMs(60_000);
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setBaseDelayMs(5);
        properties.getRetry().setMaxDelayMs(20);
        properties.getRetry().setJitter(0.0);
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void anonymousFetchMapsListingAndSkipsStickiedOnHot() {
        routes.put("/r/stocks/hot.json", exchange -> respond(exchange, 200, LISTING));
        routes.put("/r/stocks/new.json", exchange -> respond(exchange, 200, LISTING));
        RedditClient client = client();

        FetchResult hot = client.fetch("stocks", ListingType.HOT, 25);
        FetchResult fresh = client.fetch("stocks", ListingType.NEW, 500);

        assertThat(hot.outcome()).isEqualTo(FetchOutcome.SUCCESS);
        assertThat(hot.items()).extracting(RawItem::id).containsExactly("abc");
        assertThat(fresh.items()).extracting(RawItem::id).containsExactly("abc", "pin");

        RawItem item = hot.items().get(0);
        assertThat(item.source()).isEqualTo("stocks");
        assertThat(item.title()).isEqualTo("AAPL earnings beat");
        assertThat(item.body()).isEqualTo("numbers inside");
        assertThat(item.score()).isEqualTo(120);
        assertThat(item.commentCount()).isEqualTo(30);
        assertThat(item.createdAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(item.flair()).isEqualTo("DD");
        assertThat(item.reconstructUrl()).isEqualTo("https://www.reddit.com/r/stocks/comments/abc/aapl_earnings_beat/");

        assertThat(requests).containsExactly(
            "/r/stocks/hot.json?limit=25&raw_json=1",
            "/r/stocks/new.json?limit=100&raw_json=1");
        assertThat(authorizations).containsOnly("");
    }

    @Test
    void itemsKeepTheConfiguredSourceNameWhateverCaseRedditReturns() {
        routes.put("/r/stockmarket/new.json", exchange -> respond(exchange, 200,
            LISTING.replace("\"subreddit\": \"stocks\"", "\"subreddit\": \"StockMarket\"")));

        FetchResult result = client().fetch("stockmarket", ListingType.NEW, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.SUCCESS);
        assertThat(result.items()).extracting(RawItem::source).containsOnly("stockmarket");

        Aggregator aggregator = new Aggregator(Duration.ofDays(36_500), 10, true, clock);
        aggregator.registerSources(List.of("stockmarket"));
        ItemAnalyzer analyzer = new ItemAnalyzer(new EngineProperties.Analyzer());
        result.items().forEach(item -> aggregator.ingest(analyzer.analyze(item)));

        assertThat(aggregator.snapshot().sources()).containsOnlyKeys("stockmarket");
        assertThat(aggregator.snapshot().sources().get("stockmarket").windowItemCount()).isEqualTo(2);
    }

    @Test
    void rateLimitIsReportedWithRetryAfter() {
        routes.put("/r/stocks/hot.json", exchange -> {
            exchange.getResponseHeaders().add("Retry-After", "7");
            respond(exchange, 429, "{\"message\": \"Too Many Requests\"}");
        });

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.RATE_LIMITED);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(7));
        assertThat(requests).hasSize(1);
    }

    @Test
    void serverErrorsAreRetriedThenReportedAsTransient() {
        routes.put("/r/stocks/hot.json", exchange -> respond(exchange, 503, "{}"));

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.TRANSIENT_ERROR);
        assertThat(result.error()).contains("503");
        assertThat(requests).hasSize(3);
    }

    @Test
    void transientFailureRecoversWithinRetryBudget() {
        AtomicInteger calls = new AtomicInteger();
        routes.put("/r/stocks/hot.json", exchange -> {
            if (calls.incrementAndGet() == 1) {
                respond(exchange, 502, "{}");
            } else {
                respond(exchange, 200, LISTING);
            }
        });

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.items()).hasSize(1);
    }

    @Test
    void clientErrorsOtherThanAuthAreNotRetried() {
        routes.put("/r/missing/hot.json", exchange -> respond(exchange, 404, "{}"));

        FetchResult result = client().fetch("missing", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.TRANSIENT_ERROR);
        assertThat(requests).hasSize(1);
    }

    @Test
    void forbiddenListingIsAnAuthError() {
        routes.put("/r/private/hot.json", exchange -> respond(exchange, 403, "{}"));

        FetchResult result = client().fetch("private", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.AUTH_ERROR);
        assertThat(requests).hasSize(1);
    }

    @Test
    void authenticatedFetchUsesBearerTokenAndCachesIt() {
        useCredentials();
        AtomicInteger tokens = tokenRoute(3600);
        routes.put("/r/stocks/hot", exchange -> respond(exchange, 200, LISTING));
        RedditClient client = client();

        assertThat(client.fetch("stocks", ListingType.HOT, 25).isSuccess()).isTrue();
        assertThat(client.fetch("stocks", ListingType.HOT, 25).isSuccess()).isTrue();

        assertThat(tokens.get()).isEqualTo(1);
        assertThat(authorizations).contains("Bearer token-1");
        assertThat(authorizations.get(0)).startsWith("Basic ");
    }

    @Test
    void tokenIsRenewedBeforeExpiry() {
        useCredentials();
        AtomicInteger tokens = tokenRoute(90);
        routes.put("/r/stocks/hot", exchange -> respond(exchange, 200, LISTING));
        RedditClient client = client();

        client.fetch("stocks", ListingType.HOT, 25);
        clock.advance(Duration.ofSeconds(20));
        client.fetch("stocks", ListingType.HOT, 25);
        clock.advance(Duration.ofSeconds(20));
        client.fetch("stocks", ListingType.HOT, 25);

        assertThat(tokens.get()).isEqualTo(2);
        assertThat(authorizations).contains("Bearer token-2");
    }

    @Test
    void rejectedTokenIsRenewedOnceAndRequestReplayed() {
        useCredentials();
        AtomicInteger tokens = tokenRoute(3600);
        routes.put("/r/stocks/hot", exchange -> {
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            if ("Bearer token-2".equals(auth)) {
                respond(exchange, 200, LISTING);
            } else {
                respond(exchange, 401, "{\"message\": \"Unauthorized\"}");
            }
        });

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.isSuccess()).isTrue();
        assertThat(tokens.get()).isEqualTo(2);
    }

    @Test
    void persistentTokenRejectionIsAnAuthError() {
        useCredentials();
        AtomicInteger tokens = tokenRoute(3600);
        routes.put("/r/stocks/hot", exchange -> respond(exchange, 401, "{}"));

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.AUTH_ERROR);
        assertThat(tokens.get()).isEqualTo(2);
    }

    @Test
    void rejectedCredentialsAreAnAuthError() {
        useCredentials();
        routes.put("/api/v1/access_token", exchange -> respond(exchange, 401, "{\"message\": \"Unauthorized\"}"));

        FetchResult result = client().fetch("stocks", ListingType.HOT, 25);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.AUTH_ERROR);
        assertThat(requests).containsExactly("/api/v1/access_token");
    }

    @Test
    void tokenErrorBodyIsAnAuthError() {
        useCredentials();
        routes.put("/api/v1/access_token", exchange -> respond(exchange, 200, "{\"error\": \"invalid_grant\"}"));

        assertThat(client().fetch("stocks", ListingType.HOT, 25).outcome()).isEqualTo(FetchOutcome.AUTH_ERROR);
    }

    @Test
    void retryAfterFallsBackToRateLimitResetThenDefault() {
        RedditClient client = client();
        HttpHeaders reset = new HttpHeaders();
        reset.add("X-Ratelimit-Reset", "12.5");

        assertThat(client.retryAfter(reset)).isEqualTo(Duration.ofMillis(12_500));
        assertThat(client.retryAfter(new HttpHeaders())).isEqualTo(Duration.ofSeconds(60));
    }

    private void useCredentials() {
        properties.setClientId("client-id");
        properties.setClientSecret("client-secret");
    }

    private AtomicInteger tokenRoute(long expiresIn) {
        AtomicInteger tokens = new AtomicInteger();
        routes.put("/api/v1/access_token", exchange -> respond(exchange, 200,
            "{\"access_token\": \"token-" + tokens.incrementAndGet() + "\", \"token_type\": \"bearer\", "
                + "\"expires_in\": " + expiresIn + "}"));
        return tokens;
    }

    private RedditClient client() {
        WebClient webClient = WebClient.builder()
            .baseUrl(properties.getApiBaseUrl())
            .defaultHeader("User-Agent", properties.getUserAgent())
            .build();
        RedditTokenProvider tokenProvider = new RedditTokenProvider(webClient, properties, clock);
        return new RedditClient(webClient, tokenProvider, properties);
    }

    private void dispatch(HttpExchange exchange) throws IOException {
        String query = exchange.getRequestURI().getRawQuery();
        String path = exchange.getRequestURI().getPath();
        requests.add(query == null ? path : path + "?" + query);
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        authorizations.add(auth == null ? "" : auth);
        exchange.getRequestBody().readAllBytes();

        Route route = routes.get(path);
        if (route == null) {
            respond(exchange, 404, "{}");
            return;
        }
        route.handle(exchange);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Route {

        void handle(HttpExchange exchange) throws IOException;
    }
}
