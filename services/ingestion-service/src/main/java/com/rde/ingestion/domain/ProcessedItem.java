package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.List;

public record ProcessedItem(
    RawItem raw,
    List<String> tickers,
    double sentiment,
    boolean speculative,
    boolean priority
) {

    public ProcessedItem {
        tickers = tickers == null ? List.of() : List.copyOf(tickers);
    }

    public String id() {
        return raw == null ? null : raw.id();
    }

    public String source() {
        return raw == null ? null : raw.source();
    }

    public Instant createdAt() {
        return raw == null ? null : raw.createdAt();
    }

    public String key() {
        return source() + ":" + id();
    }
}
