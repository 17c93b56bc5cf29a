package com.my.relay.domain.service;

import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatistics;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.port.in.RelayStatisticsUseCase;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.domain.port.out.OutcomeLogPort;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 메모리 상태가 아닌 영속 이력에서 기간 내 처리 건수를 집계하기 위함.
 */
public class RelayStatisticsService implements RelayStatisticsUseCase {

    private final OutcomeLogPort outcomeLog;
    private final ClockPort clockPort;
    private final LocalStoragePort localStoragePort;

    public RelayStatisticsService(OutcomeLogPort outcomeLog, ClockPort clockPort, LocalStoragePort localStoragePort) {
        this.outcomeLog = outcomeLog;
        this.clockPort = clockPort;
        this.localStoragePort = localStoragePort;
    }

    @Override
    public RelayStatistics statistics(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("통계 기간은 0보다 커야 합니다.");
        }
        List<RelayOutcome> outcomes = outcomeLog.query(clockPort.now().minus(window));
        Map<RelayStatus, Long> byStatus = new EnumMap<>(RelayStatus.class);
        for (RelayOutcome outcome : outcomes) {
            byStatus.merge(outcome.status(), 1L, Long::sum);
        }
        return new RelayStatistics(window, outcomes.size(), byStatus, localStoragePort.archivedFileCount());
    }
}
