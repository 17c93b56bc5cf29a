package com.my.relay.domain.model;

/**
 * 왜: 파서, 해석기, 프로바이더 실패를 하나의 분류 체계로 묶어 엔진이 명시적으로 분기하도록 하기 위함.
 */
public enum RelayErrorKind {
    INVALID_FORMAT,
    NEEDS_MEMBERSHIP,
    RESOLUTION_FAILED,
    RESTRICTED,
    NOT_FOUND,
    TOO_LARGE,
    TRANSIENT,
    FATAL;

    public boolean isResolutionClass() {
        return this == NEEDS_MEMBERSHIP || this == RESOLUTION_FAILED;
    }

    public RelayStatus toStatus() {
        return switch (this) {
            case RESTRICTED -> RelayStatus.RESTRICTED;
            case NOT_FOUND -> RelayStatus.NOT_FOUND;
            case TOO_LARGE -> RelayStatus.TOO_LARGE;
            case TRANSIENT -> RelayStatus.TRANSIENT_ERROR;
            default -> RelayStatus.FATAL_ERROR;
        };
    }
}
