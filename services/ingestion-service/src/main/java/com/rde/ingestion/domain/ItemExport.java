package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.List;

public record ItemExport(
    Metadata metadata,
    List<ProcessedItem> items
) {

    public ItemExport {
        items = List.copyOf(items);
    }

    public record Metadata(
        int totalCount,
        Instant windowStart,
        Instant windowEnd,
        Instant generatedAt,
        int windowHours,
        List<String> sources
    ) {
    }
}
