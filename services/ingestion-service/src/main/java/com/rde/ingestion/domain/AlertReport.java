package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.List;

public record AlertReport(
    Instant timestamp,
    List<Alert> alerts,
    int alertCount
) {

    public static AlertReport of(Instant timestamp, List<Alert> alerts) {
        return new AlertReport(timestamp, List.copyOf(alerts), alerts.size());
    }
}
