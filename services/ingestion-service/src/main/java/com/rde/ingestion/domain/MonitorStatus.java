package com.rde.ingestion.domain;

import java.time.Instant;
import java.util.List;

public record MonitorStatus(
    boolean running,
    Instant startedAt,
    Instant stoppedAt,
    List<SourceStatus> sources
) {

    public MonitorStatus {
        sources = List.copyOf(sources);
    }
}
