package com.my.relay.domain.port.out;

import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MediaDescriptor;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;

import java.nio.file.Path;
import java.util.List;

/**
 * 왜: 이미 연결된 메시징 프로바이더의 조회/전달/게시 기능을 도메인이 SDK나 전송 방식에 의존하지 않고 쓰도록 하기 위함.
 * 구현체는 프로바이더 오류를 예외로 던지지 않고 {@link ProviderResult} 실패로 돌려준다.
 */
public interface ProviderPort {

    ProviderResult<ConversationHandle> resolveConversation(ConversationRef ref);

    /**
     * 현재 세션이 가입한 대화 목록을 최대 limit개까지 조회한다.
     */
    ProviderResult<List<ConversationHandle>> listJoinedConversations(int limit);

    ProviderResult<MessageContent> fetchMessage(long conversationId, long messageId);

    /**
     * 전달 표시를 유지한 채 메시지를 그대로 중계한다.
     */
    ProviderResult<Void> relay(long conversationId, long messageId, long targetId);

    /**
     * 전달 표시 없이 같은 내용을 새로 게시한다. 미디어는 프로바이더가 보유한 사본을 재사용한다.
     */
    ProviderResult<Void> republish(long targetId, MessageContent content);

    ProviderResult<Path> downloadToLocal(MediaDescriptor media, Path directory);

    ProviderResult<Void> publishLocal(long targetId, Path localPath, String caption);

    ProviderResult<ConversationHandle> join(String inviteOrRef);
}
