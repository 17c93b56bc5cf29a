package com.my.relay.domain.model;

/**
 * 왜: 배치 단위 집계를 저장하지 않고 결과 목록에서 매번 다시 계산할 수 있는 값으로 표현하기 위함.
 * failed는 total - successful이며 restrictedCount는 failed에 포함된다.
 */
public record BatchResult(int total, int successful, int failed, int restrictedCount) {

    public static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0);

    public BatchResult {
        if (total < 0 || successful < 0 || failed < 0 || restrictedCount < 0) {
            throw new IllegalArgumentException("집계 값은 음수일 수 없습니다.");
        }
        if (successful + failed != total || restrictedCount > failed) {
            throw new IllegalArgumentException("집계 값이 서로 맞지 않습니다.");
        }
    }

    /**
     * 처리 전에 거절된 항목 수만큼 실패로 계산한 결과.
     */
    public static BatchResult rejected(int itemCount) {
        return new BatchResult(itemCount, 0, itemCount, 0);
    }

    public BatchResult plus(RelayOutcome outcome) {
        boolean success = outcome.isSuccess();
        boolean restricted = outcome.status() == RelayStatus.RESTRICTED;
        return new BatchResult(total + 1,
                successful + (success ? 1 : 0),
                failed + (success ? 0 : 1),
                restrictedCount + (restricted ? 1 : 0));
    }

    public BatchResult plus(BatchResult other) {
        return new BatchResult(total + other.total,
                successful + other.successful,
                failed + other.failed,
                restrictedCount + other.restrictedCount);
    }
}
