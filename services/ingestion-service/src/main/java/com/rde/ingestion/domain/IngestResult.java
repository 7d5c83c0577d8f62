package com.rde.ingestion.domain;

public enum IngestResult {
    INSERTED,
    DUPLICATE,
    EXPIRED,
    REJECTED;

    public boolean isAccepted() {
        return this == INSERTED;
    }
}
