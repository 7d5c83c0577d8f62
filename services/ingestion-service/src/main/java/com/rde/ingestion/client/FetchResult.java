package com.rde.ingestion.client;

import com.rde.ingestion.domain.RawItem;
import java.time.Duration;
import java.util.List;

public record FetchResult(
    FetchOutcome outcome,
    List<RawItem> items,
    Duration retryAfter,
    String error
) {

    public FetchResult {
        items = items == null ? List.of() : List.copyOf(items);
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public static FetchResult success(List<RawItem> items) {
        return new FetchResult(FetchOutcome.SUCCESS, items, Duration.ZERO, null);
    }

    public static FetchResult rateLimited(Duration retryAfter, String error) {
        return new FetchResult(FetchOutcome.RATE_LIMITED, List.of(), retryAfter, error);
    }

    public static FetchResult authError(String error) {
        return new FetchResult(FetchOutcome.AUTH_ERROR, List.of(), Duration.ZERO, error);
    }

    public static FetchResult transientError(String error) {
        return new FetchResult(FetchOutcome.TRANSIENT_ERROR, List.of(), Duration.ZERO, error);
    }

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }
}
