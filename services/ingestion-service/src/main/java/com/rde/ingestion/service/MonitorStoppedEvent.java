package com.rde.ingestion.service;

import java.time.Instant;

public record MonitorStoppedEvent(Instant stoppedAt) {
}
