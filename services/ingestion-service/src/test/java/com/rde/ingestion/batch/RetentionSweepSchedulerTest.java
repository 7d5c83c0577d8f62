package com.rde.ingestion.batch;

import static com.rde.ingestion.support.Items.processed;
import static org.assertj.core.api.Assertions.assertThat;

import com.rde.ingestion.service.Aggregator;
import com.rde.ingestion.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RetentionSweepSchedulerTest {

    @Test
    void sweepEvictsExpiredItemsAtCurrentTime() {
        Instant start = Instant.parse("2024-03-01T12:00:00Z");
        MutableClock clock = new MutableClock(start);
        Aggregator aggregator = new Aggregator(Duration.ofHours(1), 10, false, clock);
        aggregator.ingest(processed("a", "stocks", start.minus(Duration.ofMinutes(50))));
        aggregator.ingest(processed("b", "stocks", start));
        RetentionSweepScheduler scheduler = new RetentionSweepScheduler(aggregator, clock);

        assertThat(scheduler.sweep()).isZero();
        clock.advance(Duration.ofMinutes(15));

        assertThat(scheduler.sweep()).isEqualTo(1);
        assertThat(aggregator.size()).isEqualTo(1);
    }
}
