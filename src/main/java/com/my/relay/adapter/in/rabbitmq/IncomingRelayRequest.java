package com.my.relay.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayRequest;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: relay-requests 채널의 JSON 계약을 한곳에서 검증하고 도메인 요청으로 바꾸기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingRelayRequest(String type,
                                  String requestId,
                                  String callerId,
                                  Long targetId,
                                  String text,
                                  String mode,
                                  Integer windowHours,
                                  Double intervalSeconds) {

    public enum Type {
        RELAY, JOIN, STATISTICS, CANCEL, PACING
    }

    public IncomingRelayRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(callerId, "callerId");
        if (requestId.isBlank() || callerId.isBlank()) {
            throw new IllegalArgumentException("요청 필드가 비어 있습니다.");
        }
        type = type == null || type.isBlank() ? Type.RELAY.name() : type.trim().toUpperCase(Locale.ROOT);
    }

    public Type requestType() {
        try {
            return Type.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("알 수 없는 요청 종류입니다: " + type, e);
        }
    }

    public RelayRequest toRelayRequest() {
        if (targetId == null) {
            throw new IllegalArgumentException("targetId가 없습니다.");
        }
        if (text == null) {
            throw new IllegalArgumentException("text가 없습니다.");
        }
        return new RelayRequest(requestId, callerId, targetId, text, relayMode());
    }

    public Duration window(Duration defaultWindow) {
        if (windowHours == null) {
            return defaultWindow;
        }
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours는 1 이상이어야 합니다.");
        }
        return Duration.ofHours(windowHours);
    }

    public Duration interval() {
        if (intervalSeconds == null || intervalSeconds.isNaN() || intervalSeconds < 0) {
            throw new IllegalArgumentException("intervalSeconds는 0 이상이어야 합니다.");
        }
        return Duration.ofMillis(Math.round(intervalSeconds * 1000));
    }

    public long targetOrZero() {
        return targetId == null ? 0L : targetId;
    }

    private RelayMode relayMode() {
        if (mode == null || mode.isBlank()) {
            return RelayMode.FORWARD;
        }
        try {
            return RelayMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("알 수 없는 중계 방식입니다: " + mode, e);
        }
    }
}
