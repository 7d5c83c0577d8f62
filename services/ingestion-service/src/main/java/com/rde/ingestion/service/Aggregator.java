package com.rde.ingestion.service;

import com.rde.ingestion.domain.AggregateSnapshot;
import com.rde.ingestion.domain.IngestResult;
import com.rde.ingestion.domain.ProcessedItem;
import com.rde.ingestion.domain.SourceStat;
import com.rde.ingestion.domain.TickerStat;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Windowed in-memory aggregate of processed items.
 *
 * <p>All mutation happens under one lock. Items are bucketed by creation minute so that eviction
 * walks only the buckets that fall out of the window. Readers get an {@link AggregateSnapshot}
 * and never see the internal structures.
 */
public class Aggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration retention;
    private final int priorityCapacity;
    private final boolean lazyEviction;
    private final Clock clock;

    private final NavigableMap<Long, List<ProcessedItem>> buckets = new TreeMap<>();
    private final Map<String, ProcessedItem> live = new HashMap<>();
    private final Map<String, TickerState> tickers = new HashMap<>();
    private final Map<String, SourceState> sources = new LinkedHashMap<>();
    private final ArrayDeque<ProcessedItem> priorityRing;
    private long totalIngested;

    public Aggregator(Duration retention, int priorityCapacity, boolean lazyEviction, Clock clock) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (priorityCapacity < 1) {
            throw new IllegalArgumentException("priority buffer size must be at least 1");
        }
        this.retention = retention;
        this.priorityCapacity = priorityCapacity;
        this.lazyEviction = lazyEviction;
        this.clock = clock;
        this.priorityRing = new ArrayDeque<>(priorityCapacity);
    }

    public void registerSources(Collection<String> names) {
        lock.lock();
        try {
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    sources.computeIfAbsent(name, SourceState::new);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public IngestResult ingest(ProcessedItem item) {
        if (item == null || item.raw() == null || isBlank(item.id()) || isBlank(item.source())
            || item.createdAt() == null) {
            LOGGER.warn("Rejecting malformed item {}", item == null ? null : item.key());
            return IngestResult.REJECTED;
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            if (lazyEviction) {
                evictLocked(now);
            }
            String key = item.key();
            if (live.containsKey(key)) {
                return IngestResult.DUPLICATE;
            }
            if (item.createdAt().isBefore(now.minus(retention))) {
                return IngestResult.EXPIRED;
            }

            live.put(key, item);
            buckets.computeIfAbsent(minuteOf(item.createdAt()), minute -> new ArrayList<>()).add(item);
            for (String symbol : new LinkedHashSet<>(item.tickers())) {
                tickers.computeIfAbsent(symbol, TickerState::new).add(item);
            }
            sources.computeIfAbsent(item.source(), SourceState::new).add(item);
            if (item.priority()) {
                if (priorityRing.size() >= priorityCapacity) {
                    priorityRing.pollFirst();
                }
                priorityRing.addLast(item);
            }
            totalIngested++;
            return IngestResult.INSERTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every item created strictly before {@code now - retention}.
     *
     * @return the number of items evicted
     */
    public int evictExpired(Instant now) {
        lock.lock();
        try {
            return evictLocked(now);
        } finally {
            lock.unlock();
        }
    }

    public AggregateSnapshot snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (lazyEviction) {
                evictLocked(now);
            }
            List<ProcessedItem> items = new ArrayList<>(live.size());
            buckets.values().forEach(items::addAll);

            Map<String, TickerStat> tickerStats = new HashMap<>();
            tickers.forEach((symbol, state) -> tickerStats.put(symbol, state.toStat()));

            Map<String, SourceStat> sourceStats = new LinkedHashMap<>();
            sources.forEach((name, state) -> sourceStats.put(name, state.toStat()));

            return new AggregateSnapshot(
                now,
                retention,
                items,
                tickerStats,
                sourceStats,
                new ArrayList<>(priorityRing),
                totalIngested
            );
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return live.size();
        } finally {
            lock.unlock();
        }
    }

    public long totalIngested() {
        lock.lock();
        try {
            return totalIngested;
        } finally {
            lock.unlock();
        }
    }

    public Duration retention() {
        return retention;
    }

    private int evictLocked(Instant now) {
        if (buckets.isEmpty()) {
            return 0;
        }
        Instant cutoff = now.minus(retention);
        long cutoffMinute = minuteOf(cutoff);
        int evicted = 0;

        Iterator<Map.Entry<Long, List<ProcessedItem>>> whole = buckets.headMap(cutoffMinute, false).entrySet().iterator();
        while (whole.hasNext()) {
            for (ProcessedItem item : whole.next().getValue()) {
                evictItem(item);
                evicted++;
            }
            whole.remove();
        }

        List<ProcessedItem> boundary = buckets.get(cutoffMinute);
        if (boundary != null) {
            Iterator<ProcessedItem> it = boundary.iterator();
            while (it.hasNext()) {
                ProcessedItem item = it.next();
                if (item.createdAt().isBefore(cutoff)) {
                    evictItem(item);
                    it.remove();
                    evicted++;
                }
            }
            if (boundary.isEmpty()) {
                buckets.remove(cutoffMinute);
            }
        }

        if (evicted > 0) {
            priorityRing.removeIf(item -> item.createdAt().isBefore(cutoff));
            LOGGER.debug("Evicted {} items created before {}", evicted, cutoff);
        }
        return evicted;
    }

    private void evictItem(ProcessedItem item) {
        live.remove(item.key());
        for (String symbol : new LinkedHashSet<>(item.tickers())) {
            TickerState state = tickers.get(symbol);
            if (state != null && state.remove(item)) {
                tickers.remove(symbol);
            }
        }
        SourceState source = sources.get(item.source());
        if (source != null) {
            source.remove(item);
        }
    }

    private static long minuteOf(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), 60L);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class TickerState {

        private final String symbol;
        private final Map<String, Integer> sourceCounts = new HashMap<>();
        private final NavigableMap<Instant, Integer> mentions = new TreeMap<>();
        private int count;

        private TickerState(String symbol) {
            this.symbol = symbol;
        }

        private void add(ProcessedItem item) {
            count++;
            sourceCounts.merge(item.source(), 1, Integer::sum);
            mentions.merge(item.createdAt(), 1, Integer::sum);
        }

        /**
         * @return true when no mentions remain
         */
        private boolean remove(ProcessedItem item) {
            count--;
            decrement(sourceCounts, item.source());
            decrement(mentions, item.createdAt());
            return count <= 0;
        }

        private TickerStat toStat() {
            return new TickerStat(symbol, count, sourceCounts.keySet(), mentions.firstKey(), mentions.lastKey());
        }

        private static <K> void decrement(Map<K, Integer> counts, K key) {
            counts.computeIfPresent(key, (k, value) -> value <= 1 ? null : value - 1);
        }
    }

    private static final class SourceState {

        private final String name;
        private long totalItemsSeen;
        private int windowCount;
        private long scoreSum;
        private long commentSum;
        private int speculativeCount;
        private Instant lastItemAt;

        private SourceState(String name) {
            this.name = name;
        }

        private void add(ProcessedItem item) {
            totalItemsSeen++;
            windowCount++;
            scoreSum += item.raw().score();
            commentSum += item.raw().commentCount();
            if (item.speculative()) {
                speculativeCount++;
            }
            if (lastItemAt == null || item.createdAt().isAfter(lastItemAt)) {
                lastItemAt = item.createdAt();
            }
        }

        private void remove(ProcessedItem item) {
            windowCount--;
            scoreSum -= item.raw().score();
            commentSum -= item.raw().commentCount();
            if (item.speculative()) {
                speculativeCount--;
            }
        }

        private SourceStat toStat() {
            if (windowCount == 0) {
                return new SourceStat(name, totalItemsSeen, 0, 0.0, 0.0, 0.0, lastItemAt);
            }
            return new SourceStat(
                name,
                totalItemsSeen,
                windowCount,
                (double) scoreSum / windowCount,
                (double) commentSum / windowCount,
                (double) speculativeCount / windowCount,
                lastItemAt
            );
        }
    }
}
