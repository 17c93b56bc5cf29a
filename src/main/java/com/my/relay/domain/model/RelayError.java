package com.my.relay.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 프로바이더 예외 타입에 기대지 않고 실패 종류와 대기 지시를 값으로 전달하기 위함.
 */
public record RelayError(RelayErrorKind kind, String detail, Duration retryAfter) {

    public RelayError {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? kind.name() : detail;
    }

    public static RelayError of(RelayErrorKind kind, String detail) {
        return new RelayError(kind, detail, null);
    }

    public static RelayError throttled(Duration retryAfter, String detail) {
        return new RelayError(RelayErrorKind.TRANSIENT, detail, retryAfter);
    }

    public Optional<Duration> advisedWait() {
        return Optional.ofNullable(retryAfter);
    }
}
