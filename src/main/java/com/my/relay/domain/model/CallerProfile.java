package com.my.relay.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 호출자별 마지막 작업 시각과 처리 건수를 프로세스 수명 동안 추적하고, 한 호출자의 배치를 순차 실행하기 위함.
 */
public class CallerProfile {

    private final String id;
    private final CallerTier tier;
    private final ReentrantLock batchLock = new ReentrantLock();
    private Instant lastOperationAt;
    private long requestCount;
    private long successCount;

    public CallerProfile(String id, CallerTier tier) {
        this.id = Objects.requireNonNull(id, "id");
        this.tier = Objects.requireNonNull(tier, "tier");
        if (id.isBlank()) {
            throw new IllegalArgumentException("호출자 ID는 비어 있을 수 없습니다.");
        }
    }

    public String id() {
        return id;
    }

    public CallerTier tier() {
        return tier;
    }

    public ReentrantLock batchLock() {
        return batchLock;
    }

    public synchronized Instant lastOperationAt() {
        return lastOperationAt;
    }

    public synchronized void markOperation(Instant at) {
        this.lastOperationAt = at;
    }

    public synchronized void recordResult(boolean success) {
        requestCount++;
        if (success) {
            successCount++;
        }
    }

    public synchronized long requestCount() {
        return requestCount;
    }

    public synchronized long successCount() {
        return successCount;
    }
}
