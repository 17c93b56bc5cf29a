package com.my.relay.domain.port.in;

import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.ResolvedConversation;

/**
 * 왜: 비공개 대화 가입을 자동으로 하지 않고 호스트 계층의 명시적 요청으로만 수행하기 위함.
 */
public interface JoinConversationUseCase {
    ProviderResult<ResolvedConversation> join(String inviteOrRef);
}
