package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 진행/최종 결과를 표현 계층이 렌더링할 수 있도록 구조화된 이벤트 하나의 형태로 고정하기 위함.
 */
public record RelayEvent(String requestId,
                         String callerId,
                         long targetId,
                         RelayEventType type,
                         int processed,
                         int total,
                         BatchResult tally,
                         RelayErrorKind errorKind,
                         String message) {

    public RelayEvent {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(callerId, "callerId");
        Objects.requireNonNull(type, "type");
        tally = tally == null ? BatchResult.EMPTY : tally;
        message = message == null ? "" : message;
    }

    public static RelayEvent of(RelayRequest request, RelayEventType type, int processed, int total,
                                BatchResult tally, String message) {
        return new RelayEvent(request.requestId(), request.callerId(), request.targetId(),
                type, processed, total, tally, null, message);
    }

    public static RelayEvent rejected(RelayRequest request, RelayErrorKind kind, BatchResult tally, String message) {
        return new RelayEvent(request.requestId(), request.callerId(), request.targetId(),
                RelayEventType.REJECTED, 0, tally.total(), tally, kind, message);
    }
}
