package com.rde.ingestion.service;

import com.rde.ingestion.client.SourceClient;
import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.domain.MonitorStatus;
import com.rde.ingestion.domain.PollerState;
import com.rde.ingestion.domain.SourceStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Owns the per-source pollers. One thread per configured source, all feeding the shared
 * {@link Aggregator}. Start and stop are idempotent; once {@link #stop()} returns no poller can
 * ingest again.
 */
@Service
public class MonitorService implements SmartLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonitorService.class);

    private final EngineProperties properties;
    private final SourceClient sourceClient;
    private final ItemAnalyzer itemAnalyzer;
    private final Aggregator aggregator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private volatile Instant startedAt;
    private volatile Instant stoppedAt;
    private volatile List<SourcePoller> pollers = List.of();
    private ExecutorService executor;
    private ReadWriteLock gate;

    public MonitorService(
        EngineProperties properties,
        SourceClient sourceClient,
        ItemAnalyzer itemAnalyzer,
        Aggregator aggregator,
        ApplicationEventPublisher eventPublisher,
        Clock clock
    ) {
        this.properties = properties;
        this.sourceClient = sourceClient;
        this.itemAnalyzer = itemAnalyzer;
        this.aggregator = aggregator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                LOGGER.debug("Monitor already running");
                return;
            }
            List<EngineProperties.Source> sources = properties.getSources();
            if (sources.isEmpty()) {
                LOGGER.warn("Monitor started with no sources configured");
            }
            aggregator.registerSources(sources.stream().map(EngineProperties.Source::getName).toList());

            gate = new ReentrantReadWriteLock();
            List<SourcePoller> created = new ArrayList<>();
            for (EngineProperties.Source source : sources) {
                created.add(new SourcePoller(
                    source.getName(),
                    properties.listingsFor(source),
                    properties.limitFor(source),
                    properties.pollIntervalFor(source),
                    properties.getMaxBackoff(),
                    properties.getIngestFilter(),
                    sourceClient,
                    itemAnalyzer,
                    aggregator,
                    gate,
                    clock
                ));
            }
            executor = Executors.newFixedThreadPool(Math.max(1, created.size()), pollerThreadFactory());
            created.forEach(executor::execute);

            pollers = List.copyOf(created);
            startedAt = clock.instant();
            stoppedAt = null;
            running = true;
            LOGGER.info("Monitor started with {} sources", created.size());
        }
    }

    @Override
    public void stop() {
        Instant stopped;
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            Duration timeout = properties.getShutdownTimeout();
            LOGGER.info("Stopping monitor, waiting up to {} for {} pollers", timeout, pollers.size());
            pollers.forEach(SourcePoller::signalStop);
            executor.shutdown();

            boolean terminated = false;
            try {
                terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }

            gate.writeLock().lock();
            try {
                pollers.forEach(SourcePoller::closeGate);
            } finally {
                gate.writeLock().unlock();
            }

            if (!terminated) {
                for (SourcePoller poller : pollers) {
                    if (!poller.isFinished()) {
                        LOGGER.warn("Poller for r/{} did not stop within {}", poller.source(), timeout);
                        poller.markTimedOut(timeout);
                    }
                }
                executor.shutdownNow();
            }

            stopped = clock.instant();
            stoppedAt = stopped;
            running = false;
            LOGGER.info("Monitor stopped");
        }
        eventPublisher.publishEvent(new MonitorStoppedEvent(stopped));
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    public MonitorStatus status() {
        List<SourcePoller> current = pollers;
        List<SourceStatus> sources;
        if (current.isEmpty() && startedAt == null) {
            sources = properties.getSources().stream()
                .map(source -> new SourceStatus(source.getName(), PollerState.IDLE, null, null, null, 0, 0, 0, null))
                .toList();
        } else {
            sources = current.stream().map(SourcePoller::status).toList();
        }
        return new MonitorStatus(running, startedAt, stoppedAt, sources);
    }

    private ThreadFactory pollerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "source-poller-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
