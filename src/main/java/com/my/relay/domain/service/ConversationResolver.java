package com.my.relay.domain.service;

import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.ProviderPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 대화 참조를 정규 핸들로 바꾸는 비용을 TTL 캐시로 줄이고, 세션이 모르는 대화는 가입 목록 스캔으로 한 번 더 찾기 위함.
 *
 * <p>같은 키에 대한 해석은 키 해시로 고른 락으로 직렬화되어 두 작업자가 서로 다른 항목을 덮어쓰지 않는다.
 * 가입이 필요한 실패는 캐시하지 않는다.
 */
public class ConversationResolver {

    private static final Logger log = Logger.getLogger(ConversationResolver.class);
    private static final int LOCK_STRIPES = 64;

    private final ProviderPort providerPort;
    private final ClockPort clockPort;
    private final Duration ttl;
    private final int scanLimit;
    private final Map<String, ResolvedConversation> cache = new ConcurrentHashMap<>();
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    public ConversationResolver(ProviderPort providerPort, ClockPort clockPort, Duration ttl, int scanLimit) {
        this.providerPort = providerPort;
        this.clockPort = clockPort;
        this.ttl = ttl;
        this.scanLimit = scanLimit;
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    public ProviderResult<ResolvedConversation> resolve(ConversationRef ref) {
        String key = ref.normalizedKey();
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ResolvedConversation cached = cache.get(key);
            if (cached != null && !cached.isExpired(clockPort.now(), ttl)) {
                return ProviderResult.ok(cached);
            }
            ProviderResult<ConversationHandle> lookup = lookup(ref);
            if (!lookup.isOk()) {
                cache.remove(key);
                log.warnf("대화 해석 실패 ref=%s kind=%s detail=%s", key, lookup.error().kind(), lookup.error().detail());
                return ProviderResult.failure(lookup.error());
            }
            ResolvedConversation resolved = toResolved(ref, lookup.value());
            cache.put(key, resolved);
            return ProviderResult.ok(resolved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이후 작업에서 해석 계열 오류가 나면 오래된 핸들을 쓰지 않도록 즉시 제거한다.
     */
    public void invalidate(ConversationRef ref) {
        if (cache.remove(ref.normalizedKey()) != null) {
            log.debugf("대화 캐시 무효화 ref=%s", ref.normalizedKey());
        }
    }

    /**
     * 명시적 가입 요청. 성공하면 가입한 대화를 ID 키로 캐시한다.
     */
    public ProviderResult<ResolvedConversation> join(String inviteOrRef) {
        ProviderResult<ConversationHandle> joined = ProviderCall.guarded(() -> providerPort.join(inviteOrRef));
        if (!joined.isOk()) {
            return ProviderResult.failure(joined.error());
        }
        ConversationRef ref = ConversationRef.ofId(joined.value().id());
        ResolvedConversation resolved = toResolved(ref, joined.value());
        cache.put(ref.normalizedKey(), resolved);
        log.infof("대화 가입 완료 id=%d title=%s", resolved.canonicalId(), resolved.displayName());
        return ProviderResult.ok(resolved);
    }

    public int cachedEntries() {
        return cache.size();
    }

    /**
     * 락 수를 고정해 대화 수가 늘어나도 락 테이블이 커지지 않는다. 같은 키는 항상 같은 락을 쓴다.
     */
    ReentrantLock lockFor(String key) {
        return keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
    }

    private ProviderResult<ConversationHandle> lookup(ConversationRef ref) {
        ProviderResult<ConversationHandle> direct = ProviderCall.guarded(() -> providerPort.resolveConversation(ref));
        if (direct.isOk() || direct.error().kind() != RelayErrorKind.RESOLUTION_FAILED) {
            return direct;
        }
        Optional<ConversationHandle> scanned = scanJoined(ref);
        if (scanned.isPresent()) {
            log.infof("가입 목록 스캔으로 대화를 찾았습니다 ref=%s id=%d", ref, scanned.get().id());
            return ProviderResult.ok(scanned.get());
        }
        return direct;
    }

    private Optional<ConversationHandle> scanJoined(ConversationRef ref) {
        ProviderResult<List<ConversationHandle>> joined = ProviderCall.guarded(() -> providerPort.listJoinedConversations(scanLimit));
        if (!joined.isOk()) {
            return Optional.empty();
        }
        return joined.value().stream()
                .limit(scanLimit)
                .filter(handle -> handle.matches(ref))
                .findFirst();
    }

    private ResolvedConversation toResolved(ConversationRef ref, ConversationHandle handle) {
        Instant now = clockPort.now();
        return new ResolvedConversation(ref, handle.id(), handle.title(), now, handle.restricted());
    }
}
