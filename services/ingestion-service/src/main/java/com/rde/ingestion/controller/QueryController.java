package com.rde.ingestion.controller;

import com.rde.ingestion.domain.AlertReport;
import com.rde.ingestion.domain.ExportDocument;
import com.rde.ingestion.domain.ItemExport;
import com.rde.ingestion.domain.ProcessedItem;
import com.rde.ingestion.domain.SentimentSummary;
import com.rde.ingestion.domain.SourceStat;
import com.rde.ingestion.domain.SpeculativeSignals;
import com.rde.ingestion.domain.TickerTrend;
import com.rde.ingestion.service.QueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class QueryController {

    static final int DEFAULT_EXPORT_WINDOW_HOURS = 24;

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/tickers/trending")
    public List<TickerTrend> trending(@RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return queryService.trendingTickers(limit);
    }

    @GetMapping("/sentiment")
    public SentimentSummary sentiment() {
        return queryService.sentimentSummary();
    }

    @GetMapping("/priority-items")
    public List<ProcessedItem> priorityItems(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return queryService.priorityItems(limit);
    }

    @GetMapping("/sources")
    public List<SourceStat> sources() {
        return queryService.sourceStats();
    }

    @GetMapping("/signals/speculative")
    public SpeculativeSignals speculativeSignals() {
        return queryService.speculativeSignals();
    }

    @PostMapping("/export")
    public ItemExport export(@Valid @RequestBody ExportRequest request) {
        int windowHours = request.windowHours() == null ? DEFAULT_EXPORT_WINDOW_HOURS : request.windowHours();
        return queryService.export(request.sources() == null ? List.of() : request.sources(), windowHours);
    }

    @GetMapping("/export/full")
    public ExportDocument fullExport() {
        return queryService.fullExport();
    }

    @GetMapping("/alerts")
    public AlertReport alerts() {
        return queryService.alertCheck();
    }
}
