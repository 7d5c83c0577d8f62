package com.rde.ingestion.client;

import java.util.Locale;

public enum ListingType {
    HOT(true),
    NEW(false),
    RISING(true);

    private final boolean skipsStickied;

    ListingType(boolean skipsStickied) {
        this.skipsStickied = skipsStickied;
    }

    public boolean skipsStickied() {
        return skipsStickied;
    }

    public String path() {
        return name().toLowerCase(Locale.ROOT);
    }
}
