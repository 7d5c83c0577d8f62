package com.rde.ingestion.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;

public record ExportRequest(
    List<String> sources,

    @Min(1)
    @Max(168)
    Integer windowHours
) {
}
