package com.my.relay.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.LongStream;

/**
 * 왜: 처리할 메시지 ID 구간을 하나로 묶고, 요청 구간이 잘렸는지 여부를 호출자에게 그대로 알리기 위함.
 */
public record MessageRange(ConversationRef conversation, long startId, long endId, long requestedEndId) {

    public MessageRange {
        Objects.requireNonNull(conversation, "conversation");
        if (startId <= 0) {
            throw new IllegalArgumentException("메시지 ID는 1 이상이어야 합니다.");
        }
        if (endId < startId || requestedEndId < endId) {
            throw new IllegalArgumentException("메시지 구간이 올바르지 않습니다: " + startId + "-" + endId);
        }
    }

    public static MessageRange single(ConversationRef conversation, long messageId) {
        return new MessageRange(conversation, messageId, messageId, messageId);
    }

    /**
     * 요청 구간을 최대 개수로 자른 범위를 만든다. 잘린 경우 {@link #clamped()}가 true가 된다.
     */
    public static MessageRange clampedTo(ConversationRef conversation, long startId, long requestedEndId, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize는 1 이상이어야 합니다.");
        }
        long lastAllowed = startId + maxSize - 1;
        long endId = Math.min(requestedEndId, lastAllowed);
        return new MessageRange(conversation, startId, endId, requestedEndId);
    }

    public int size() {
        return Math.toIntExact(endId - startId + 1);
    }

    public long requestedSize() {
        return requestedEndId - startId + 1;
    }

    public boolean clamped() {
        return requestedEndId > endId;
    }

    public List<Long> ids() {
        return LongStream.rangeClosed(startId, endId).boxed().toList();
    }
}
