package com.rde.ingestion.config;

import com.rde.ingestion.client.ListingType;
import com.rde.ingestion.domain.AlertRuleType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private boolean autoStart = false;
    private List<Source> sources = new ArrayList<>();
    private Duration defaultPollInterval = Duration.ofSeconds(60);
    private int defaultLimit = 25;
    private List<ListingType> defaultListings = new ArrayList<>(List.of(ListingType.HOT, ListingType.NEW));
    private int retentionHours = 24;
    private int priorityBufferSize = 100;
    private boolean lazyEviction = true;
    private long sweepIntervalMs = 60_000;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Duration maxBackoff = Duration.ofMinutes(15);
    private double neutralBand = 0.1;
    private IngestFilter ingestFilter = new IngestFilter();
    private Analyzer analyzer = new Analyzer();
    private Alerts alerts = new Alerts();
    private Export export = new Export();

    public Duration retention() {
        return Duration.ofHours(retentionHours);
    }

    public Duration pollIntervalFor(Source source) {
        return source.getPollInterval() == null ? defaultPollInterval : source.getPollInterval();
    }

    public int limitFor(Source source) {
        return source.getLimit() == null ? defaultLimit : source.getLimit();
    }

    public List<ListingType> listingsFor(Source source) {
        return source.getListings() == null || source.getListings().isEmpty()
            ? defaultListings
            : source.getListings();
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    public Duration getDefaultPollInterval() {
        return defaultPollInterval;
    }

    public void setDefaultPollInterval(Duration defaultPollInterval) {
        this.defaultPollInterval = defaultPollInterval;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public List<ListingType> getDefaultListings() {
        return defaultListings;
    }

    public void setDefaultListings(List<ListingType> defaultListings) {
        this.defaultListings = defaultListings;
    }

    public int getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(int retentionHours) {
        this.retentionHours = retentionHours;
    }

    public int getPriorityBufferSize() {
        return priorityBufferSize;
    }

    public void setPriorityBufferSize(int priorityBufferSize) {
        this.priorityBufferSize = priorityBufferSize;
    }

    public boolean isLazyEviction() {
        return lazyEviction;
    }

    public void setLazyEviction(boolean lazyEviction) {
        this.lazyEviction = lazyEviction;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public double getNeutralBand() {
        return neutralBand;
    }

    public void setNeutralBand(double neutralBand) {
        this.neutralBand = neutralBand;
    }

    public IngestFilter getIngestFilter() {
        return ingestFilter;
    }

    public void setIngestFilter(IngestFilter ingestFilter) {
        this.ingestFilter = ingestFilter;
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    public void setAnalyzer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public static class Source {

        private String name;
        private String group = "other";
        private List<ListingType> listings = new ArrayList<>();
        private Duration pollInterval;
        private Integer limit;

        public Source() {
        }

        public Source(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public List<ListingType> getListings() {
            return listings;
        }

        public void setListings(List<ListingType> listings) {
            this.listings = listings;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }
    }

    public static class IngestFilter {

        private int minScore = 10;
        private int minComments = 5;

        public boolean accepts(int score, int comments) {
            return score >= minScore && comments >= minComments;
        }

        public int getMinScore() {
            return minScore;
        }

        public void setMinScore(int minScore) {
            this.minScore = minScore;
        }

        public int getMinComments() {
            return minComments;
        }

        public void setMinComments(int minComments) {
            this.minComments = minComments;
        }
    }

    /**
     * Lookup tables and thresholds for item analysis. The tables are deployment data; the
     * defaults shipped in application.yml are a starting point, not a reference list.
     */
    public static class Analyzer {

        private List<String> tickerAllowList = new ArrayList<>();
        private Map<String, Double> bullish = new LinkedHashMap<>();
        private Map<String, Double> bearish = new LinkedHashMap<>();
        private List<String> speculativeKeywords = new ArrayList<>();
        private List<String> speculativeSources = new ArrayList<>();
        private double normalizationWords = 10.0;
        private Meme meme = new Meme();
        private Priority priority = new Priority();

        public List<String> getTickerAllowList() {
            return tickerAllowList;
        }

        public void setTickerAllowList(List<String> tickerAllowList) {
            this.tickerAllowList = tickerAllowList;
        }

        public Map<String, Double> getBullish() {
            return bullish;
        }

        public void setBullish(Map<String, Double> bullish) {
            this.bullish = bullish;
        }

        public Map<String, Double> getBearish() {
            return bearish;
        }

        public void setBearish(Map<String, Double> bearish) {
            this.bearish = bearish;
        }

        public List<String> getSpeculativeKeywords() {
            return speculativeKeywords;
        }

        public void setSpeculativeKeywords(List<String> speculativeKeywords) {
            this.speculativeKeywords = speculativeKeywords;
        }

        public List<String> getSpeculativeSources() {
            return speculativeSources;
        }

        public void setSpeculativeSources(List<String> speculativeSources) {
            this.speculativeSources = speculativeSources;
        }

        public double getNormalizationWords() {
            return normalizationWords;
        }

        public void setNormalizationWords(double normalizationWords) {
            this.normalizationWords = normalizationWords;
        }

        public Meme getMeme() {
            return meme;
        }

        public void setMeme(Meme meme) {
            this.meme = meme;
        }

        public Priority getPriority() {
            return priority;
        }

        public void setPriority(Priority priority) {
            this.priority = priority;
        }
    }

    public static class Meme {

        private int maxTitleChars = 40;
        private int maxBodyChars = 20;
        private int minScore = 1_000;

        public int getMaxTitleChars() {
            return maxTitleChars;
        }

        public void setMaxTitleChars(int maxTitleChars) {
            this.maxTitleChars = maxTitleChars;
        }

        public int getMaxBodyChars() {
            return maxBodyChars;
        }

        public void setMaxBodyChars(int maxBodyChars) {
            this.maxBodyChars = maxBodyChars;
        }

        public int getMinScore() {
            return minScore;
        }

        public void setMinScore(int minScore) {
            this.minScore = minScore;
        }
    }

    public static class Priority {

        private int minScore = 250;
        private int minComments = 25;

        public int getMinScore() {
            return minScore;
        }

        public void setMinScore(int minScore) {
            this.minScore = minScore;
        }

        public int getMinComments() {
            return minComments;
        }

        public void setMinComments(int minComments) {
            this.minComments = minComments;
        }
    }

    public static class Alerts {

        private List<AlertRule> rules = new ArrayList<>();

        public List<AlertRule> getRules() {
            return rules;
        }

        public void setRules(List<AlertRule> rules) {
            this.rules = rules;
        }
    }

    public static class AlertRule {

        private AlertRuleType type;
        private String symbol;
        private double threshold;
        private int windowMinutes = 60;
        private String severity = "warning";

        public AlertRule() {
        }

        public AlertRule(AlertRuleType type, double threshold, int windowMinutes) {
            this.type = type;
            this.threshold = threshold;
            this.windowMinutes = windowMinutes;
        }

        public AlertRuleType getType() {
            return type;
        }

        public void setType(AlertRuleType type) {
            this.type = type;
        }

        public String getSymbol() {
            return symbol;
        }

        public void setSymbol(String symbol) {
            this.symbol = symbol;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }
    }

    public static class Export {

        private boolean enabled = false;
        private String directory = "exports";
        private long intervalMs = 300_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
