package com.rde.ingestion.batch;

import com.rde.ingestion.service.Aggregator;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RetentionSweepScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweepScheduler.class);

    private final Aggregator aggregator;
    private final Clock clock;

    public RetentionSweepScheduler(Aggregator aggregator, Clock clock) {
        this.aggregator = aggregator;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${engine.sweep-interval-ms:60000}")
    public int sweep() {
        int evicted = aggregator.evictExpired(clock.instant());
        if (evicted > 0) {
            LOGGER.info("Retention sweep evicted {} items, {} remain", evicted, aggregator.size());
        }
        return evicted;
    }
}
