package com.rde.ingestion.domain;

import java.util.List;

public record SpeculativeSignals(
    int totalSpeculativeItems,
    double speculativeRatio,
    List<ProcessedItem> recentSpeculativeItems,
    List<SourceRatio> activeSpeculativeSources
) {

    public record SourceRatio(String source, double speculativeRatio, int windowItemCount) {
    }
}
