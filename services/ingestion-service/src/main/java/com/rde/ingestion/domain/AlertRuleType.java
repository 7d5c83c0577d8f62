package com.rde.ingestion.domain;

public enum AlertRuleType {
    TICKER_MENTIONS,
    SPECULATION_RATIO,
    EXTREME_SENTIMENT,
    SOURCE_STALLED
}
