package com.my.relay.adapter.out.provider;

import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MediaDescriptor;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.port.out.ProviderPort;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 개발 환경에서 실제 프로바이더 세션 없이 메모리 대화와 메시지로 중계 흐름을 검증하기 위함.
 *
 * <p>공개 대화 {@code @dev_public}(-1001000000001)과 전달 제한 대화 {@code @dev_restricted}(-1001000000002)를 가진다.
 * 5의 배수 번호 메시지는 미디어를 포함한다.
 */
@IfBuildProfile("dev")
@ApplicationScoped
public class DevProviderAdapter implements ProviderPort {

    static final long PUBLIC_ID = -1001000000001L;
    static final long RESTRICTED_ID = -1001000000002L;
    static final int MESSAGES_PER_CONVERSATION = 200;

    private static final Logger log = Logger.getLogger(DevProviderAdapter.class);

    private final Map<Long, ConversationHandle> conversations = new ConcurrentHashMap<>();
    private final List<String> published = new ArrayList<>();

    public DevProviderAdapter() {
        conversations.put(PUBLIC_ID, new ConversationHandle(PUBLIC_ID, "Dev Public", "dev_public", false));
        conversations.put(RESTRICTED_ID, new ConversationHandle(RESTRICTED_ID, "Dev Restricted", "dev_restricted", true));
    }

    @Override
    public ProviderResult<ConversationHandle> resolveConversation(ConversationRef ref) {
        return conversations.values().stream()
                .filter(handle -> handle.matches(ref))
                .findFirst()
                .map(ProviderResult::ok)
                .orElseGet(() -> ProviderResult.failure(RelayErrorKind.RESOLUTION_FAILED, "PEER_ID_INVALID"));
    }

    @Override
    public ProviderResult<List<ConversationHandle>> listJoinedConversations(int limit) {
        return ProviderResult.ok(conversations.values().stream().limit(limit).toList());
    }

    @Override
    public ProviderResult<MessageContent> fetchMessage(long conversationId, long messageId) {
        if (!conversations.containsKey(conversationId)) {
            return ProviderResult.failure(RelayErrorKind.RESOLUTION_FAILED, "CHANNEL_INVALID");
        }
        if (messageId > MESSAGES_PER_CONVERSATION) {
            return ProviderResult.failure(RelayErrorKind.NOT_FOUND, "MESSAGE_ID_INVALID");
        }
        String text = "dev message " + messageId + " from " + conversationId;
        if (messageId % 5 == 0) {
            MediaDescriptor media = new MediaDescriptor(conversationId + ":" + messageId,
                    "dev-" + messageId + ".txt", "text/plain", text.length());
            return ProviderResult.ok(MessageContent.media(media, text));
        }
        return ProviderResult.ok(MessageContent.text(text));
    }

    @Override
    public ProviderResult<Void> relay(long conversationId, long messageId, long targetId) {
        ConversationHandle handle = conversations.get(conversationId);
        if (handle == null) {
            return ProviderResult.failure(RelayErrorKind.RESOLUTION_FAILED, "CHANNEL_INVALID");
        }
        if (handle.restricted()) {
            return ProviderResult.failure(RelayErrorKind.RESTRICTED, "CHAT_FORWARDS_RESTRICTED");
        }
        return record("[DEV MOCK] relay %d/%d -> %d", conversationId, messageId, targetId);
    }

    @Override
    public ProviderResult<Void> republish(long targetId, MessageContent content) {
        return record("[DEV MOCK] republish -> %d media=%s", targetId, content.hasMedia(), 0L);
    }

    @Override
    public ProviderResult<Path> downloadToLocal(MediaDescriptor media, Path directory) {
        Path target = directory.resolve(HttpProviderGateway.safeFileName(media));
        try {
            Files.createDirectories(directory);
            Files.writeString(target, "dev media " + media.reference(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return ProviderResult.failure(RelayErrorKind.TRANSIENT, "로컬 쓰기 실패: " + e.getMessage());
        }
        log.infof("[DEV MOCK] download %s -> %s", media.reference(), target);
        return ProviderResult.ok(target);
    }

    @Override
    public ProviderResult<Void> publishLocal(long targetId, Path localPath, String caption) {
        if (!Files.exists(localPath)) {
            return ProviderResult.failure(RelayErrorKind.FATAL, "로컬 파일이 없습니다: " + localPath);
        }
        return record("[DEV MOCK] publish local %s -> %d", localPath.getFileName(), targetId, 0L);
    }

    @Override
    public ProviderResult<ConversationHandle> join(String inviteOrRef) {
        long id = -1002000000000L - Math.abs((long) inviteOrRef.hashCode() % 1_000_000L);
        ConversationHandle handle = conversations.computeIfAbsent(id,
                key -> new ConversationHandle(key, "Dev Joined " + inviteOrRef, null, false));
        log.infof("[DEV MOCK] join %s -> %d", inviteOrRef, handle.id());
        return ProviderResult.ok(handle);
    }

    synchronized List<String> published() {
        return List.copyOf(published);
    }

    private synchronized ProviderResult<Void> record(String format, Object first, Object second, Object third) {
        String line = String.format(format, first, second, third);
        published.add(line);
        log.info(line);
        return ProviderResult.done();
    }
}
