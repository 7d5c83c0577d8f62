package com.rde.ingestion.domain;

public record SentimentSummary(
    Mood mood,
    double average,
    int positive,
    int negative,
    int neutral,
    int total
) {

    public static SentimentSummary empty() {
        return new SentimentSummary(Mood.NEUTRAL, 0.0, 0, 0, 0, 0);
    }
}
