package com.my.relay.domain.exception;

import com.my.relay.domain.model.RelayErrorKind;

/**
 * 왜: 인식할 수 없는 참조 문자열을 네트워크 접근 전에 명확한 실패로 알리기 위함.
 */
public class InvalidReferenceException extends RuntimeException {

    public InvalidReferenceException(String message) {
        super(message);
    }

    public InvalidReferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public RelayErrorKind kind() {
        return RelayErrorKind.INVALID_FORMAT;
    }
}
