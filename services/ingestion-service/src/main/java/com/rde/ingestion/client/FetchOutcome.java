package com.rde.ingestion.client;

public enum FetchOutcome {
    SUCCESS,
    RATE_LIMITED,
    AUTH_ERROR,
    TRANSIENT_ERROR
}
