package com.my.relay.domain.model;

/**
 * 왜: 메시지 한 건의 처리 결과를 영속 로그와 통계가 같은 기준으로 집계하도록 고정하기 위함.
 */
public enum RelayStatus {
    SUCCESS,
    RESTRICTED,
    NOT_FOUND,
    TOO_LARGE,
    TRANSIENT_ERROR,
    FATAL_ERROR
}
