package com.rde.ingestion.domain;

import java.time.Instant;

public record RawItem(
    String id,
    String source,
    String title,
    String body,
    String author,
    int score,
    int commentCount,
    Instant createdAt,
    String permalink,
    String url,
    double upvoteRatio,
    String flair,
    boolean stickied,
    boolean over18
) {

    private static final String REDDIT_BASE_URL = "https://www.reddit.com";

    public RawItem {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        author = author == null || author.isBlank() ? "[deleted]" : author;
    }

    public RawItem(
        String id,
        String source,
        String title,
        String body,
        int score,
        int commentCount,
        Instant createdAt
    ) {
        this(id, source, title, body, null, score, commentCount, createdAt,
            "/r/" + source + "/comments/" + id + "/", null, 1.0, null, false, false);
    }

    public String reconstructUrl() {
        if (permalink != null && !permalink.isBlank()) {
            return permalink.startsWith("http") ? permalink : REDDIT_BASE_URL + permalink;
        }
        return url;
    }

    public String content() {
        return title + " " + body;
    }
}
