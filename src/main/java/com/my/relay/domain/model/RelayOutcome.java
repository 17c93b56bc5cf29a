package com.my.relay.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 처리된 메시지 한 건의 결과를 생성 후 변경 없이 로그에 추가하도록 불변 기록으로 고정하기 위함.
 */
public record RelayOutcome(long conversationId,
                           long messageId,
                           long targetId,
                           RelayStatus status,
                           String reason,
                           Instant timestamp) {

    public RelayOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        reason = reason == null ? "" : reason;
    }

    public boolean isSuccess() {
        return status == RelayStatus.SUCCESS;
    }
}
