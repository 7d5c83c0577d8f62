package com.rde.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reddit")
public class RedditProperties {

    private String clientId;
    private String clientSecret;
    private String username;
    private String password;
    private String userAgent = "RedditDataEngine/1.0";
    private String authBaseUrl = "https://www.reddit.com";
    private String apiBaseUrl = "https://oauth.reddit.com";
    private String publicBaseUrl = "https://www.reddit.com";
    private long requestTimeoutMs = 15_000;
    private int maxInMemoryMb = 4;
    private long tokenRefreshSkewSeconds = 60;
    private long defaultRateLimitDelayMs = 60_000;
    private Retry retry = new Retry();

    public boolean hasCredentials() {
        return clientId != null && !clientId.isBlank();
    }

    public boolean usesPasswordGrant() {
        return username != null && !username.isBlank() && password != null;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getAuthBaseUrl() {
        return authBaseUrl;
    }

    public void setAuthBaseUrl(String authBaseUrl) {
        this.authBaseUrl = authBaseUrl;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxInMemoryMb() {
        return maxInMemoryMb;
    }

    public void setMaxInMemoryMb(int maxInMemoryMb) {
        this.maxInMemoryMb = maxInMemoryMb;
    }

    public long getTokenRefreshSkewSeconds() {
        return tokenRefreshSkewSeconds;
    }

    public void setTokenRefreshSkewSeconds(long tokenRefreshSkewSeconds) {
        this.tokenRefreshSkewSeconds = tokenRefreshSkewSeconds;
    }

    public long getDefaultRateLimitDelayMs() {
        return defaultRateLimitDelayMs;
    }

    public void setDefaultRateLimitDelayMs(long defaultRateLimitDelayMs) {
        this.defaultRateLimitDelayMs = defaultRateLimitDelayMs;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public static class Retry {

        private int maxAttempts = 3;
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        private double jitter = 0.2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }
}
