package com.my.relay.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 왜: 기간 내 처리 이력을 상태별 건수로 요약해 통계 요청에 그대로 응답하기 위함.
 */
public record RelayStatistics(Duration window, long total, Map<RelayStatus, Long> byStatus, long archivedFiles) {

    public RelayStatistics {
        Objects.requireNonNull(window, "window");
        EnumMap<RelayStatus, Long> copy = new EnumMap<>(RelayStatus.class);
        for (RelayStatus status : RelayStatus.values()) {
            copy.put(status, byStatus == null ? 0L : byStatus.getOrDefault(status, 0L));
        }
        byStatus = Collections.unmodifiableMap(copy);
    }

    public RelayStatistics(Duration window, long total, Map<RelayStatus, Long> byStatus) {
        this(window, total, byStatus, 0L);
    }

    public long count(RelayStatus status) {
        return byStatus.get(status);
    }

    public long successful() {
        return count(RelayStatus.SUCCESS);
    }

    public long failed() {
        return total - successful();
    }
}
