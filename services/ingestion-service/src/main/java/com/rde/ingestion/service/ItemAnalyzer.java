package com.rde.ingestion.service;

import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.domain.MalformedItemException;
import com.rde.ingestion.domain.ProcessedItem;
import com.rde.ingestion.domain.RawItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a {@link RawItem} into a {@link ProcessedItem}. Stateless after construction and safe
 * to share between poller threads.
 */
public class ItemAnalyzer {

    private static final Pattern TICKER_PATTERN = Pattern.compile("\\$([A-Za-z]{1,5})\\b|\\b([A-Z]{2,5})\\b");
    private static final Pattern WORD_PATTERN = Pattern.compile("[a-z0-9']+");

    private final Set<String> tickerAllowList;
    private final Map<String, Double> lexicon;
    private final int longestPhrase;
    private final Pattern speculativePattern;
    private final Set<String> speculativeSources;
    private final double normalizationWords;
    private final EngineProperties.Meme meme;
    private final EngineProperties.Priority priority;

    public ItemAnalyzer(EngineProperties.Analyzer config) {
        this.tickerAllowList = config.getTickerAllowList().stream()
            .map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.lexicon = buildLexicon(config.getBullish(), config.getBearish());
        this.longestPhrase = lexicon.keySet().stream()
            .mapToInt(phrase -> phrase.split(" ").length)
            .max()
            .orElse(1);
        this.speculativePattern = keywordPattern(config.getSpeculativeKeywords());
        this.speculativeSources = config.getSpeculativeSources().stream()
            .map(source -> source.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.normalizationWords = config.getNormalizationWords() <= 0 ? 10.0 : config.getNormalizationWords();
        this.meme = config.getMeme();
        this.priority = config.getPriority();
    }

    public ProcessedItem analyze(RawItem item) {
        if (item == null) {
            throw new MalformedItemException("item is null");
        }
        if (item.id() == null || item.id().isBlank()) {
            throw new MalformedItemException("item has no id (source " + item.source() + ")");
        }
        if (item.source() == null || item.source().isBlank()) {
            throw new MalformedItemException("item " + item.id() + " has no source");
        }
        if (item.createdAt() == null) {
            throw new MalformedItemException("item " + item.id() + " has no creation time");
        }

        String content = item.content();
        return new ProcessedItem(
            item,
            extractTickers(content),
            sentiment(content),
            isSpeculative(item, content),
            isPriority(item)
        );
    }

    public List<String> extractTickers(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = TICKER_PATTERN.matcher(text);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                found.add(matcher.group(1).toUpperCase(Locale.ROOT));
            } else if (tickerAllowList.contains(matcher.group(2))) {
                found.add(matcher.group(2));
            }
        }
        return List.copyOf(found);
    }

    public double sentiment(String text) {
        if (text == null || text.isBlank() || lexicon.isEmpty()) {
            return 0.0;
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        if (tokens.isEmpty()) {
            return 0.0;
        }

        double sum = 0.0;
        boolean hit = false;
        int position = 0;
        while (position < tokens.size()) {
            int consumed = 0;
            int maxLength = Math.min(longestPhrase, tokens.size() - position);
            for (int length = maxLength; length >= 1; length--) {
                Double weight = lexicon.get(String.join(" ", tokens.subList(position, position + length)));
                if (weight != null) {
                    sum += weight;
                    hit = true;
                    consumed = length;
                    break;
                }
            }
            position += consumed == 0 ? 1 : consumed;
        }
        if (!hit) {
            return 0.0;
        }

        double normalized = sum / Math.max(1.0, tokens.size() / normalizationWords);
        return Math.max(-1.0, Math.min(1.0, normalized));
    }

    private boolean isSpeculative(RawItem item, String content) {
        if (speculativePattern != null && speculativePattern.matcher(content).find()) {
            return true;
        }
        if (speculativeSources.contains(item.source().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return item.title().length() <= meme.getMaxTitleChars()
            && item.body().length() <= meme.getMaxBodyChars()
            && item.score() >= meme.getMinScore();
    }

    private boolean isPriority(RawItem item) {
        return item.score() > priority.getMinScore() && item.commentCount() > priority.getMinComments();
    }

    private static Map<String, Double> buildLexicon(Map<String, Double> bullish, Map<String, Double> bearish) {
        Map<String, Double> merged = new HashMap<>();
        bullish.forEach((term, weight) -> merged.merge(normalizeTerm(term), Math.abs(weight), Double::sum));
        bearish.forEach((term, weight) -> merged.merge(normalizeTerm(term), -Math.abs(weight), Double::sum));
        merged.remove("");
        return Map.copyOf(merged);
    }

    private static String normalizeTerm(String term) {
        return String.join(" ", term.trim().toLowerCase(Locale.ROOT).split("\\s+"));
    }

    private static Pattern keywordPattern(List<String> keywords) {
        Set<String> alternatives = new HashSet<>();
        for (String keyword : keywords) {
            String trimmed = keyword == null ? "" : keyword.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (String part : trimmed.split("\\s+")) {
                parts.add(Pattern.quote(part));
            }
            alternatives.add(String.join("\\s+", parts));
        }
        if (alternatives.isEmpty()) {
            return null;
        }
        return Pattern.compile("\\b(?:" + String.join("|", alternatives) + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
