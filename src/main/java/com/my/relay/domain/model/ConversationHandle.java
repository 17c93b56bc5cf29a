package com.my.relay.domain.model;

/**
 * 왜: 프로바이더가 돌려준 대화 정보를 도메인 캐시 항목으로 변환하기 전의 최소 형태로 표현하기 위함.
 */
public record ConversationHandle(long id, String title, String username, boolean restricted) {

    public boolean matches(ConversationRef ref) {
        if (ref.isNumeric()) {
            return ref.numericId() == id;
        }
        return username != null && username.equalsIgnoreCase(ref.username());
    }
}
