package com.my.relay.domain.service;

import com.my.relay.adapter.out.outcome.InMemoryOutcomeLog;
import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatistics;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.support.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RelayStatisticsServiceTest {

    @Test
    void counts_only_outcomes_inside_window() {
        ManualClock clock = ManualClock.startingAt("2026-01-02T00:00:00Z");
        InMemoryOutcomeLog log = new InMemoryOutcomeLog();
        log.append(outcome(RelayStatus.SUCCESS, "2026-01-01T23:00:00Z"));
        log.append(outcome(RelayStatus.RESTRICTED, "2026-01-01T12:00:00Z"));
        log.append(outcome(RelayStatus.SUCCESS, "2025-12-31T23:00:00Z"));
        log.append(outcome(RelayStatus.NOT_FOUND, "2026-01-01T00:00:00Z"));

        LocalStoragePort storagePort = mock(LocalStoragePort.class);
        when(storagePort.archivedFileCount()).thenReturn(4L);

        RelayStatistics stats = new RelayStatisticsService(log, clock, storagePort).statistics(Duration.ofHours(24));

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.successful()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(2);
        assertThat(stats.count(RelayStatus.RESTRICTED)).isEqualTo(1);
        assertThat(stats.count(RelayStatus.FATAL_ERROR)).isZero();
        assertThat(stats.archivedFiles()).isEqualTo(4);
    }

    @Test
    void rejects_empty_window() {
        RelayStatisticsService service = new RelayStatisticsService(new InMemoryOutcomeLog(),
                ManualClock.startingAt("2026-01-01T00:00:00Z"), mock(LocalStoragePort.class));

        assertThatThrownBy(() -> service.statistics(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    private static RelayOutcome outcome(RelayStatus status, String at) {
        return new RelayOutcome(-100L, 1L, 2L, status, status.name(), Instant.parse(at));
    }
}
