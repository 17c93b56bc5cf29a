package com.my.relay.domain.model;

import java.util.Locale;

/**
 * 왜: 숫자 ID와 공개 이름 두 형태의 대화 참조를 하나의 불변 값으로 다뤄 캐시 키와 로그 표현을 일관되게 하기 위함.
 */
public record ConversationRef(Long numericId, String username) {

    public static final String SUPERGROUP_PREFIX = "-100";

    public ConversationRef {
        if ((numericId == null) == (username == null)) {
            throw new IllegalArgumentException("numericId와 username 중 정확히 하나만 지정해야 합니다.");
        }
        if (username != null) {
            username = username.startsWith("@") ? username.substring(1) : username;
            if (username.isBlank()) {
                throw new IllegalArgumentException("username은 비어 있을 수 없습니다.");
            }
        }
    }

    public static ConversationRef ofId(long id) {
        return new ConversationRef(id, null);
    }

    public static ConversationRef ofUsername(String username) {
        return new ConversationRef(null, username);
    }

    /**
     * 짧은 형태(양수)의 내부 번호를 -100 접두 규칙의 슈퍼그룹 ID로 바꾼다.
     */
    public static ConversationRef ofShortId(long shortId) {
        if (shortId <= 0) {
            return ofId(shortId);
        }
        return ofId(Long.parseLong(SUPERGROUP_PREFIX + shortId));
    }

    public boolean isNumeric() {
        return numericId != null;
    }

    public boolean isSupergroup() {
        return numericId != null && String.valueOf(numericId).startsWith(SUPERGROUP_PREFIX);
    }

    public String normalizedKey() {
        return isNumeric() ? String.valueOf(numericId) : "@" + username.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return normalizedKey();
    }
}
