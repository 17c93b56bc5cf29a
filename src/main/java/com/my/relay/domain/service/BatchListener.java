package com.my.relay.domain.service;

import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.RelayErrorKind;

import java.time.Duration;

/**
 * 배치 진행 중 발생하는 중간 신호를 받는 콜백. 기본 구현은 아무것도 하지 않는다.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onProgress(int processed, int total, BatchResult tally) {
    }

    default void onBackoff(long messageId, Duration wait) {
    }

    default void onRejected(RelayErrorKind kind, String detail) {
    }

    default void onCancelled(int processed, int total, BatchResult tally) {
    }
}
