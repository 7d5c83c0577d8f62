package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.Set;

public record TickerStat(
    String symbol,
    int mentionCount,
    Set<String> sources,
    Instant firstSeen,
    Instant lastSeen
) {

    public TickerStat {
        sources = Set.copyOf(sources);
    }
}
