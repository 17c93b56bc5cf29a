package com.my.relay.domain.port.in;

import com.my.relay.domain.model.RelayStatistics;

import java.time.Duration;

public interface RelayStatisticsUseCase {
    RelayStatistics statistics(Duration window);
}
