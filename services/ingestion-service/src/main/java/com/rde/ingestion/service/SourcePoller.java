package com.rde.ingestion.service;

import com.rde.ingestion.client.FetchResult;
import com.rde.ingestion.client.ListingType;
import com.rde.ingestion.client.SourceClient;
import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.domain.MalformedItemException;
import com.rde.ingestion.domain.PollerState;
import com.rde.ingestion.domain.ProcessedItem;
import com.rde.ingestion.domain.RawItem;
import com.rde.ingestion.domain.SourceStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls one source until signalled. Each cycle fetches every configured listing, filters,
 * analyzes and ingests the items, then waits for the poll interval or a backoff delay.
 *
 * <p>Ingest goes through the monitor's gate: the read lock is held per item and the poller's
 * {@code accepting} flag is cleared under the write lock once the monitor stops.
 */
class SourcePoller implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourcePoller.class);
    private static final int MAX_BACKOFF_EXPONENT = 20;

    private final String source;
    private final List<ListingType> listings;
    private final int limit;
    private final Duration interval;
    private final Duration maxBackoff;
    private final EngineProperties.IngestFilter filter;
    private final SourceClient sourceClient;
    private final ItemAnalyzer itemAnalyzer;
    private final Aggregator aggregator;
    private final ReadWriteLock gate;
    private final Clock clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile boolean accepting = true;
    private volatile boolean finished;
    private PollerState state = PollerState.IDLE;
    private Instant lastPollAt;
    private Instant lastSuccessAt;
    private Instant nextPollAt;
    private int consecutiveErrors;
    private long totalErrors;
    private long itemsIngested;
    private String lastError;

    SourcePoller(
        String source,
        List<ListingType> listings,
        int limit,
        Duration interval,
        Duration maxBackoff,
        EngineProperties.IngestFilter filter,
        SourceClient sourceClient,
        ItemAnalyzer itemAnalyzer,
        Aggregator aggregator,
        ReadWriteLock gate,
        Clock clock
    ) {
        this.source = source;
        this.listings = List.copyOf(listings);
        this.limit = limit;
        this.interval = interval;
        this.maxBackoff = maxBackoff;
        this.filter = filter;
        this.sourceClient = sourceClient;
        this.itemAnalyzer = itemAnalyzer;
        this.aggregator = aggregator;
        this.gate = gate;
        this.clock = clock;
    }

    @Override
    public void run() {
        LOGGER.info("Poller for r/{} started ({} every {})", source, listings, interval);
        try {
            while (!isStopRequested()) {
                Duration delay = pollCycle();
                if (delay == null) {
                    return;
                }
                synchronized (this) {
                    nextPollAt = clock.instant().plus(delay);
                }
                if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException ex) {
            LOGGER.error("Poller for r/{} failed", source, ex);
            transition(PollerState.STOPPED_WITH_ERROR, ex.getMessage());
        } finally {
            finish();
        }
    }

    /**
     * Runs one fetch cycle over every listing.
     *
     * @return the delay before the next cycle, or null when the poller must not continue
     */
    Duration pollCycle() {
        transition(PollerState.FETCHING, null);
        synchronized (this) {
            lastPollAt = clock.instant();
        }
        for (ListingType listing : listings) {
            if (isStopRequested()) {
                return interval;
            }
            FetchResult result = sourceClient.fetch(source, listing, limit);
            switch (result.outcome()) {
                case SUCCESS -> ingestAll(result.items());
                case AUTH_ERROR -> {
                    LOGGER.error("Stopping poller for r/{}: authentication failed", source);
                    synchronized (this) {
                        totalErrors++;
                        consecutiveErrors++;
                        nextPollAt = null;
                    }
                    transition(PollerState.AUTH_FAILED, result.error());
                    return null;
                }
                case RATE_LIMITED, TRANSIENT_ERROR -> {
                    return recordFailure(result);
                }
                default -> throw new IllegalStateException("Unknown fetch outcome " + result.outcome());
            }
        }
        synchronized (this) {
            consecutiveErrors = 0;
            lastSuccessAt = clock.instant();
            lastError = null;
        }
        transition(PollerState.IDLE, null);
        return interval;
    }

    private Duration recordFailure(FetchResult result) {
        int errors;
        synchronized (this) {
            consecutiveErrors++;
            totalErrors++;
            errors = consecutiveErrors;
        }
        Duration delay = backoffDelay(interval, errors, maxBackoff, result.retryAfter());
        LOGGER.warn("r/{} {} ({} consecutive), backing off {}", source, result.outcome(), errors, delay);
        transition(PollerState.BACKOFF, result.error());
        return delay;
    }

    static Duration backoffDelay(Duration interval, int consecutiveErrors, Duration maxBackoff, Duration retryAfter) {
        long factor = 1L << Math.min(Math.max(consecutiveErrors, 0), MAX_BACKOFF_EXPONENT);
        Duration exponential = interval.multipliedBy(factor);
        if (exponential.compareTo(maxBackoff) > 0) {
            exponential = maxBackoff;
        }
        return retryAfter != null && retryAfter.compareTo(exponential) > 0 ? retryAfter : exponential;
    }

    private void ingestAll(List<RawItem> items) {
        int inserted = 0;
        for (RawItem item : items) {
            if (!filter.accepts(item.score(), item.commentCount())) {
                continue;
            }
            ProcessedItem processed;
            try {
                processed = itemAnalyzer.analyze(item);
            } catch (MalformedItemException ex) {
                LOGGER.warn("Dropping malformed item from r/{}: {}", source, ex.getMessage());
                continue;
            }
            gate.readLock().lock();
            try {
                if (!accepting) {
                    LOGGER.debug("Ingest gate closed for r/{}, discarding remaining items", source);
                    return;
                }
                if (aggregator.ingest(processed).isAccepted()) {
                    inserted++;
                    synchronized (this) {
                        itemsIngested++;
                    }
                }
            } finally {
                gate.readLock().unlock();
            }
        }
        if (inserted > 0) {
            LOGGER.debug("Ingested {} new items from r/{}", inserted, source);
        }
    }

    void signalStop() {
        stopSignal.countDown();
    }

    /**
     * Must be called while holding the gate's write lock.
     */
    void closeGate() {
        accepting = false;
    }

    boolean isFinished() {
        return finished;
    }

    synchronized void markTimedOut(Duration timeout) {
        if (!state.isTerminal()) {
            state = PollerState.STOPPED_WITH_ERROR;
            lastError = "did not stop within " + timeout;
            nextPollAt = null;
        }
    }

    String source() {
        return source;
    }

    synchronized SourceStatus status() {
        return new SourceStatus(
            source,
            state,
            lastPollAt,
            lastSuccessAt,
            nextPollAt,
            consecutiveErrors,
            totalErrors,
            itemsIngested,
            lastError
        );
    }

    private boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    private synchronized void transition(PollerState next, String error) {
        if (state.isTerminal()) {
            return;
        }
        state = next;
        if (error != null) {
            lastError = error;
        }
    }

    private void finish() {
        synchronized (this) {
            if (!state.isTerminal()) {
                state = PollerState.STOPPED;
            }
            nextPollAt = null;
        }
        finished = true;
        LOGGER.info("Poller for r/{} exited in state {}", source, status().state());
    }
}
