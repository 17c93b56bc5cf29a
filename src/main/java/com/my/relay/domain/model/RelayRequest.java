package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 호스트 계층이 넘기는 원시 참조 문자열과 대상, 호출자를 하나의 요청 계약으로 고정하기 위함.
 */
public record RelayRequest(String requestId, String callerId, long targetId, String text, RelayMode mode) {

    public RelayRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(callerId, "callerId");
        Objects.requireNonNull(text, "text");
        mode = mode == null ? RelayMode.FORWARD : mode;
        if (callerId.isBlank()) {
            throw new IllegalArgumentException("callerId는 비어 있을 수 없습니다.");
        }
    }
}
