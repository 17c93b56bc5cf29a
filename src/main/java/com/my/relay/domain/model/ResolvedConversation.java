package com.my.relay.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 해석이 끝난 대화 핸들을 캐시와 전략 엔진이 읽기 전용으로 공유하도록 불변 값으로 고정하기 위함.
 */
public record ResolvedConversation(ConversationRef ref,
                                   long canonicalId,
                                   String displayName,
                                   Instant resolvedAt,
                                   boolean restricted) {

    public ResolvedConversation {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        displayName = displayName == null ? "" : displayName;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !resolvedAt.plus(ttl).isAfter(now);
    }
}
