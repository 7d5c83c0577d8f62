package com.rde.ingestion.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Mood {
    BULLISH,
    NEUTRAL,
    BEARISH;

    // Means within this distance of zero are floating-point residue from cancelling scores.
    private static final double ZERO_TOLERANCE = 1e-9;

    public static Mood fromMean(double mean) {
        if (Math.abs(mean) < ZERO_TOLERANCE) {
            return NEUTRAL;
        }
        if (mean > 0) {
            return BULLISH;
        }
        if (mean < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
