package com.my.relay.domain.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 왜: 진행 중인 배치를 항목 사이에서만 협조적으로 멈추게 해 절반만 기록된 결과가 생기지 않도록 하기 위함.
 */
public final class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
}
