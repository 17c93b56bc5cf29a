package com.my.relay.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 기록용 결과와 오케스트레이터가 재시도/캐시 무효화 판단에 쓸 마지막 실패 분류를 함께 돌려주기 위함.
 */
public record RelayAttempt(RelayOutcome outcome, RelayStrategy strategy, RelayError failure) {

    public RelayAttempt {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static RelayAttempt succeeded(RelayOutcome outcome, RelayStrategy strategy) {
        return new RelayAttempt(outcome, strategy, null);
    }

    public static RelayAttempt failed(RelayOutcome outcome, RelayError failure) {
        return new RelayAttempt(outcome, null, failure);
    }

    public Optional<RelayError> lastFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public boolean isTransient() {
        return outcome.status() == RelayStatus.TRANSIENT_ERROR;
    }
}
