package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.List;

public record TickerTrend(
    int rank,
    String symbol,
    int mentions,
    List<String> sources,
    Instant firstSeen,
    Instant lastSeen
) {
}
