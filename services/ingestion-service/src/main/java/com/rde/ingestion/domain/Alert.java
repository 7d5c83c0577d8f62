package com.rde.ingestion.domain;

public record Alert(
    AlertRuleType type,
    String subject,
    String message,
    String severity,
    double observed,
    double threshold
) {
}
