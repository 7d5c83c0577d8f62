package com.rde.ingestion.domain;

import java.time.Instant;

public record SourceStatus(
    String source,
    PollerState state,
    Instant lastPollAt,
    Instant lastSuccessAt,
    Instant nextPollAt,
    int consecutiveErrors,
    long totalErrors,
    long itemsIngested,
    String lastError
) {
}
