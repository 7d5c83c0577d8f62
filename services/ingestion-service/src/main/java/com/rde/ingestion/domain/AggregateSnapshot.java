package com.rde.ingestion.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the aggregator state taken under its lock. Safe to share across threads.
 */
public record AggregateSnapshot(
    Instant takenAt,
    Duration retention,
    List<ProcessedItem> items,
    Map<String, TickerStat> tickers,
    Map<String, SourceStat> sources,
    List<ProcessedItem> priorityItems,
    long totalIngested
) {

    public AggregateSnapshot {
        items = List.copyOf(items);
        tickers = Map.copyOf(tickers);
        sources = Map.copyOf(sources);
        priorityItems = List.copyOf(priorityItems);
    }

    public int itemCount() {
        return items.size();
    }
}
