package com.rde.ingestion.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SourcePollerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);
    private static final Duration MAX = Duration.ofMinutes(15);

    @Test
    void backoffDoublesPerConsecutiveError() {
        assertThat(SourcePoller.backoffDelay(INTERVAL, 1, MAX, Duration.ZERO)).isEqualTo(Duration.ofSeconds(120));
        assertThat(SourcePoller.backoffDelay(INTERVAL, 3, MAX, Duration.ZERO)).isEqualTo(Duration.ofSeconds(480));
    }

    @Test
    void backoffIsCappedAtMaximum() {
        assertThat(SourcePoller.backoffDelay(INTERVAL, 10, MAX, Duration.ZERO)).isEqualTo(MAX);
        assertThat(SourcePoller.backoffDelay(INTERVAL, 500, MAX, null)).isEqualTo(MAX);
    }

    @Test
    void retryAfterWinsWhenLonger() {
        assertThat(SourcePoller.backoffDelay(INTERVAL, 1, MAX, Duration.ofMinutes(20))).isEqualTo(Duration.ofMinutes(20));
        assertThat(SourcePoller.backoffDelay(INTERVAL, 1, MAX, Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(120));
    }
}
