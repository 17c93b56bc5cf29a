package com.my.relay.domain.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * 왜: 프로바이더 호출 결과를 성공 값 또는 {@link RelayError} 중 하나로 표현해 예외 기반 분기를 없애기 위함.
 */
public final class ProviderResult<T> {

    private static final ProviderResult<Void> DONE = new ProviderResult<>(null, null);

    private final T value;
    private final RelayError error;

    private ProviderResult(T value, RelayError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ProviderResult<T> ok(T value) {
        return new ProviderResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static ProviderResult<Void> done() {
        return DONE;
    }

    public static <T> ProviderResult<T> failure(RelayError error) {
        return new ProviderResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> ProviderResult<T> failure(RelayErrorKind kind, String detail) {
        return failure(RelayError.of(kind, detail));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new NoSuchElementException("실패한 결과에는 값이 없습니다: " + error.kind());
        }
        return value;
    }

    public RelayError error() {
        if (error == null) {
            throw new NoSuchElementException("성공한 결과에는 오류가 없습니다.");
        }
        return error;
    }

    public <R> ProviderResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return ProviderResult.ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "ProviderResult[ok]" : "ProviderResult[" + error.kind() + ": " + error.detail() + "]";
    }
}
