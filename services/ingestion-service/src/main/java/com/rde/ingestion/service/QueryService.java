package com.rde.ingestion.service;

import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.domain.AggregateSnapshot;
import com.rde.ingestion.domain.Alert;
import com.rde.ingestion.domain.AlertReport;
import com.rde.ingestion.domain.AlertRuleType;
import com.rde.ingestion.domain.ExportDocument;
import com.rde.ingestion.domain.ItemExport;
import com.rde.ingestion.domain.MonitorStatus;
import com.rde.ingestion.domain.Mood;
import com.rde.ingestion.domain.ProcessedItem;
import com.rde.ingestion.domain.SentimentSummary;
import com.rde.ingestion.domain.SourceStat;
import com.rde.ingestion.domain.SourceStatus;
import com.rde.ingestion.domain.SpeculativeSignals;
import com.rde.ingestion.domain.TickerStat;
import com.rde.ingestion.domain.TickerTrend;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Read side of the engine. Every method works on a single {@link AggregateSnapshot}, so one
 * answer never mixes two states of the aggregator.
 */
@Service
public class QueryService {

    static final int EXPORT_TOP_TICKERS = 20;
    static final int SIGNAL_RECENT_ITEMS = 10;
    static final int SIGNAL_TOP_SOURCES = 5;
    static final double SIGNAL_MIN_SOURCE_RATIO = 0.1;
    static final String UNGROUPED = "other";

    private static final Comparator<TickerStat> TRENDING_ORDER = Comparator
        .comparingInt(TickerStat::mentionCount).reversed()
        .thenComparing(TickerStat::lastSeen, Comparator.reverseOrder())
        .thenComparing(TickerStat::symbol);

    private static final Comparator<ProcessedItem> NEWEST_FIRST = Comparator
        .comparing(ProcessedItem::createdAt, Comparator.reverseOrder())
        .thenComparing(ProcessedItem::id);

    private final Aggregator aggregator;
    private final MonitorService monitorService;
    private final EngineProperties properties;
    private final Clock clock;

    public QueryService(
        Aggregator aggregator,
        MonitorService monitorService,
        EngineProperties properties,
        Clock clock
    ) {
        this.aggregator = aggregator;
        this.monitorService = monitorService;
        this.properties = properties;
        this.clock = clock;
    }

    public List<TickerTrend> trendingTickers(int limit) {
        return trending(aggregator.snapshot(), limit);
    }

    public SentimentSummary sentimentSummary() {
        return sentiment(aggregator.snapshot().items());
    }

    public List<ProcessedItem> priorityItems(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return aggregator.snapshot().priorityItems().stream()
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }

    public ItemExport export(Collection<String> sources, int windowHours) {
        if (windowHours < 1) {
            throw new IllegalArgumentException("windowHours must be at least 1");
        }
        AggregateSnapshot snapshot = aggregator.snapshot();
        Instant windowEnd = snapshot.takenAt();
        Instant windowStart = windowEnd.minus(Duration.ofHours(windowHours));
        List<String> requested = sources == null ? List.of() : sources.stream()
            .filter(source -> source != null && !source.isBlank())
            .map(String::trim)
            .toList();
        Set<String> wanted = requested.stream()
            .map(source -> source.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        List<ProcessedItem> items = snapshot.items().stream()
            .filter(item -> wanted.isEmpty() || wanted.contains(item.source().toLowerCase(Locale.ROOT)))
            .filter(item -> !item.createdAt().isBefore(windowStart))
            .sorted(NEWEST_FIRST)
            .toList();

        return new ItemExport(
            new ItemExport.Metadata(items.size(), windowStart, windowEnd, clock.instant(), windowHours, requested),
            items
        );
    }

    public AlertReport alertCheck() {
        AggregateSnapshot snapshot = aggregator.snapshot();
        Instant now = snapshot.takenAt();
        List<Alert> alerts = new ArrayList<>();
        for (EngineProperties.AlertRule rule : properties.getAlerts().getRules()) {
            if (rule.getType() == null) {
                continue;
            }
            switch (rule.getType()) {
                case TICKER_MENTIONS -> alerts.addAll(tickerMentionAlerts(rule, snapshot, now));
                case SPECULATION_RATIO -> {
                    double ratio = speculativeRatio(snapshot.items());
                    if (ratio > rule.getThreshold()) {
                        alerts.add(new Alert(
                            AlertRuleType.SPECULATION_RATIO,
                            "all",
                            String.format(Locale.ROOT, "speculative ratio %.2f above %.2f", ratio, rule.getThreshold()),
                            rule.getSeverity(),
                            ratio,
                            rule.getThreshold()
                        ));
                    }
                }
                case EXTREME_SENTIMENT -> {
                    double mean = mean(snapshot.items());
                    if (Math.abs(mean) > rule.getThreshold()) {
                        alerts.add(new Alert(
                            AlertRuleType.EXTREME_SENTIMENT,
                            Mood.fromMean(mean).label(),
                            String.format(Locale.ROOT, "mean sentiment %.3f beyond +/-%.2f", mean, rule.getThreshold()),
                            rule.getSeverity(),
                            mean,
                            rule.getThreshold()
                        ));
                    }
                }
                case SOURCE_STALLED -> alerts.addAll(stalledSourceAlerts(rule, now));
                default -> throw new IllegalStateException("Unhandled alert rule " + rule.getType());
            }
        }
        return AlertReport.of(clock.instant(), alerts);
    }

    public List<SourceStat> sourceStats() {
        return aggregator.snapshot().sources().values().stream()
            .sorted(Comparator.comparing(SourceStat::source))
            .toList();
    }

    public SpeculativeSignals speculativeSignals() {
        AggregateSnapshot snapshot = aggregator.snapshot();
        List<ProcessedItem> speculative = snapshot.items().stream()
            .filter(ProcessedItem::speculative)
            .toList();
        List<ProcessedItem> recent = snapshot.priorityItems().stream()
            .filter(ProcessedItem::speculative)
            .sorted(NEWEST_FIRST)
            .limit(SIGNAL_RECENT_ITEMS)
            .toList();
        List<SpeculativeSignals.SourceRatio> activeSources = snapshot.sources().values().stream()
            .filter(stat -> stat.speculativeRatio() > SIGNAL_MIN_SOURCE_RATIO)
            .sorted(Comparator.comparingDouble(SourceStat::speculativeRatio).reversed()
                .thenComparing(SourceStat::source))
            .limit(SIGNAL_TOP_SOURCES)
            .map(stat -> new SpeculativeSignals.SourceRatio(stat.source(), stat.speculativeRatio(), stat.windowItemCount()))
            .toList();
        return new SpeculativeSignals(speculative.size(), speculativeRatio(snapshot.items()), recent, activeSources);
    }

    public ExportDocument fullExport() {
        AggregateSnapshot snapshot = aggregator.snapshot();

        Map<String, Integer> trendingTickers = new LinkedHashMap<>();
        for (TickerTrend trend : trending(snapshot, EXPORT_TOP_TICKERS)) {
            trendingTickers.put(trend.symbol(), trend.mentions());
        }

        Map<String, ExportDocument.SourceInsight> insights = new LinkedHashMap<>();
        snapshot.sources().values().stream()
            .sorted(Comparator.comparing(SourceStat::source))
            .forEach(stat -> insights.put(stat.source(), new ExportDocument.SourceInsight(
                groupOf(stat.source()),
                stat.totalItemsSeen(),
                stat.windowItemCount(),
                stat.averageScore(),
                stat.averageComments(),
                stat.speculativeRatio(),
                stat.lastItemAt()
            )));

        List<ExportDocument.PriorityPost> priorityPosts = snapshot.priorityItems().stream()
            .sorted(NEWEST_FIRST)
            .map(item -> new ExportDocument.PriorityPost(
                item.id(),
                item.source(),
                item.raw().title(),
                item.raw().score(),
                item.raw().commentCount(),
                item.sentiment(),
                item.tickers(),
                item.raw().reconstructUrl(),
                item.createdAt(),
                item.speculative()
            ))
            .toList();

        SentimentSummary sentiment = sentiment(snapshot.items());
        return new ExportDocument(
            new ExportDocument.Metadata(snapshot.takenAt(), snapshot.itemCount(), snapshot.retention().toHours()),
            trendingTickers,
            insights,
            priorityPosts,
            new ExportDocument.SentimentBlock(
                sentiment.mood(),
                sentiment.average(),
                sentiment.positive(),
                sentiment.negative(),
                sentiment.neutral(),
                sentiment.total()
            )
        );
    }

    public MonitorStatus status() {
        return monitorService.status();
    }

    private List<TickerTrend> trending(AggregateSnapshot snapshot, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<TickerStat> ordered = snapshot.tickers().values().stream()
            .sorted(TRENDING_ORDER)
            .limit(limit)
            .toList();
        List<TickerTrend> trends = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            TickerStat stat = ordered.get(i);
            trends.add(new TickerTrend(
                i + 1,
                stat.symbol(),
                stat.mentionCount(),
                stat.sources().stream().sorted().toList(),
                stat.firstSeen(),
                stat.lastSeen()
            ));
        }
        return trends;
    }

    private SentimentSummary sentiment(List<ProcessedItem> items) {
        if (items.isEmpty()) {
            return SentimentSummary.empty();
        }
        double band = properties.getNeutralBand();
        int positive = 0;
        int negative = 0;
        int neutral = 0;
        for (ProcessedItem item : items) {
            if (item.sentiment() > band) {
                positive++;
            } else if (item.sentiment() < -band) {
                negative++;
            } else {
                neutral++;
            }
        }
        double mean = mean(items);
        return new SentimentSummary(Mood.fromMean(mean), mean, positive, negative, neutral, items.size());
    }

    private List<Alert> tickerMentionAlerts(EngineProperties.AlertRule rule, AggregateSnapshot snapshot, Instant now) {
        Instant since = now.minus(Duration.ofMinutes(rule.getWindowMinutes()));
        String symbol = rule.getSymbol() == null || rule.getSymbol().isBlank()
            ? null
            : rule.getSymbol().trim().toUpperCase(Locale.ROOT);

        Map<String, Integer> counts = new HashMap<>();
        for (ProcessedItem item : snapshot.items()) {
            if (item.createdAt().isBefore(since)) {
                continue;
            }
            for (String ticker : item.tickers()) {
                if (symbol == null || symbol.equals(ticker)) {
                    counts.merge(ticker, 1, Integer::sum);
                }
            }
        }

        return counts.entrySet().stream()
            .filter(entry -> entry.getValue() > rule.getThreshold())
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
            .map(entry -> new Alert(
                AlertRuleType.TICKER_MENTIONS,
                entry.getKey(),
                String.format(Locale.ROOT, "%s mentioned %d times in the last %d minutes",
                    entry.getKey(), entry.getValue(), rule.getWindowMinutes()),
                rule.getSeverity(),
                entry.getValue(),
                rule.getThreshold()
            ))
            .toList();
    }

    private List<Alert> stalledSourceAlerts(EngineProperties.AlertRule rule, Instant now) {
        MonitorStatus status = monitorService.status();
        if (!status.running()) {
            return List.of();
        }
        Instant threshold = now.minus(Duration.ofMinutes(rule.getWindowMinutes()));
        List<Alert> alerts = new ArrayList<>();
        for (SourceStatus source : status.sources()) {
            Instant since = source.lastSuccessAt() != null ? source.lastSuccessAt() : status.startedAt();
            if (since != null && since.isBefore(threshold)) {
                double minutes = Duration.between(since, now).toSeconds() / 60.0;
                alerts.add(new Alert(
                    AlertRuleType.SOURCE_STALLED,
                    source.source(),
                    "no updates since " + since,
                    rule.getSeverity(),
                    minutes,
                    rule.getWindowMinutes()
                ));
            }
        }
        return alerts;
    }

    private String groupOf(String source) {
        return properties.getSources().stream()
            .filter(configured -> configured.getName().equalsIgnoreCase(source))
            .map(EngineProperties.Source::getGroup)
            .findFirst()
            .orElse(UNGROUPED);
    }

    private static double mean(List<ProcessedItem> items) {
        if (items.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (ProcessedItem item : items) {
            sum += item.sentiment();
        }
        return sum / items.size();
    }

    private static double speculativeRatio(List<ProcessedItem> items) {
        if (items.isEmpty()) {
            return 0.0;
        }
        long speculative = items.stream().filter(ProcessedItem::speculative).count();
        return (double) speculative / items.size();
    }
}
