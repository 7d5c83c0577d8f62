package com.rde.ingestion.domain;

import java.time.Instant;

public record SourceStat(
    String source,
    long totalItemsSeen,
    int windowItemCount,
    double averageScore,
    double averageComments,
    double speculativeRatio,
    Instant lastItemAt
) {
}
