package com.rde.ingestion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ExportDocument(
    Metadata metadata,
    @JsonProperty("trending_tickers") Map<String, Integer> trendingTickers,
    @JsonProperty("subreddit_insights") Map<String, SourceInsight> subredditInsights,
    @JsonProperty("recent_priority_posts") List<PriorityPost> recentPriorityPosts,
    @JsonProperty("sentiment_analysis") SentimentBlock sentimentAnalysis
) {

    public record Metadata(
        Instant timestamp,
        @JsonProperty("total_posts") int totalPosts,
        @JsonProperty("data_window_hours") long dataWindowHours
    ) {
    }

    public record SourceInsight(
        String group,
        @JsonProperty("total_posts") long totalPosts,
        @JsonProperty("window_posts") int windowPosts,
        @JsonProperty("avg_score") double avgScore,
        @JsonProperty("avg_comments") double avgComments,
        @JsonProperty("speculative_ratio") double speculativeRatio,
        @JsonProperty("last_item_at") Instant lastItemAt
    ) {
    }

    public record PriorityPost(
        String id,
        String subreddit,
        String title,
        int score,
        int comments,
        double sentiment,
        List<String> tickers,
        String url,
        @JsonProperty("created_utc") Instant createdUtc,
        @JsonProperty("is_speculative") boolean speculative
    ) {
    }

    public record SentimentBlock(
        Mood mood,
        double average,
        int positive,
        int negative,
        int neutral,
        int total
    ) {
    }
}
