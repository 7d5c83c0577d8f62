package com.rde.ingestion.domain;

public enum PollerState {
    IDLE,
    FETCHING,
    BACKOFF,
    STOPPED,
    STOPPED_WITH_ERROR,
    AUTH_FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == STOPPED_WITH_ERROR || this == AUTH_FAILED;
    }
}
