package com.my.relay.domain.model;

/**
 * 왜: 어떤 방식으로 내용을 재현했는지 로그와 이벤트에서 식별하기 위함.
 */
public enum RelayStrategy {
    DIRECT_RELAY,
    RE_EMISSION,
    FETCH_THEN_REPUBLISH,
    ARCHIVE
}
