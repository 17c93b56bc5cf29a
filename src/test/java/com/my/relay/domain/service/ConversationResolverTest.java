package com.my.relay.domain.service;

import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.out.ProviderPort;
import com.my.relay.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationResolverTest {

    private static final ConversationRef REF = ConversationRef.ofId(-100123L);
    private static final ConversationHandle HANDLE = new ConversationHandle(-100123L, "채널", "chan", false);

    private ProviderPort providerPort;
    private ManualClock clock;
    private ConversationResolver resolver;

    @BeforeEach
    void setUp() {
        providerPort = mock(ProviderPort.class);
        clock = ManualClock.startingAt("2026-01-01T00:00:00Z");
        resolver = new ConversationResolver(providerPort, clock, Duration.ofHours(1), 200);
    }

    @Test
    void second_lookup_within_ttl_hits_cache() {
        when(providerPort.resolveConversation(REF)).thenReturn(ProviderResult.ok(HANDLE));

        ProviderResult<ResolvedConversation> first = resolver.resolve(REF);
        clock.advance(Duration.ofMinutes(59));
        ProviderResult<ResolvedConversation> second = resolver.resolve(REF);

        assertThat(first.value().canonicalId()).isEqualTo(-100123L);
        assertThat(second.value()).isEqualTo(first.value());
        verify(providerPort, times(1)).resolveConversation(REF);
    }

    @Test
    void lock_table_stays_bounded_across_many_conversations() {
        Set<ReentrantLock> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (long id = 1; id <= 10_000; id++) {
            locks.add(resolver.lockFor(ConversationRef.ofId(-100_000_000_000L - id).normalizedKey()));
        }

        assertThat(locks).hasSizeLessThanOrEqualTo(64);
        assertThat(resolver.lockFor(REF.normalizedKey())).isSameAs(resolver.lockFor(REF.normalizedKey()));
    }

    @Test
    void expired_entry_is_resolved_again() {
        when(providerPort.resolveConversation(REF)).thenReturn(ProviderResult.ok(HANDLE));

        resolver.resolve(REF);
        clock.advance(Duration.ofHours(1));
        resolver.resolve(REF);

        verify(providerPort, times(2)).resolveConversation(REF);
    }

    @Test
    void falls_back_to_joined_list_scan() {
        ConversationRef byName = ConversationRef.ofUsername("@Chan");
        when(providerPort.resolveConversation(byName))
                .thenReturn(ProviderResult.failure(RelayErrorKind.RESOLUTION_FAILED, "USERNAME_NOT_OCCUPIED"));
        when(providerPort.listJoinedConversations(200))
                .thenReturn(ProviderResult.ok(List.of(new ConversationHandle(-1009L, "다른 곳", "other", false), HANDLE)));

        ProviderResult<ResolvedConversation> result = resolver.resolve(byName);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().canonicalId()).isEqualTo(-100123L);
        assertThat(result.value().displayName()).isEqualTo("채널");
    }

    @Test
    void scan_miss_returns_original_failure() {
        when(providerPort.resolveConversation(REF))
                .thenReturn(ProviderResult.failure(RelayErrorKind.RESOLUTION_FAILED, "PEER_ID_INVALID"));
        when(providerPort.listJoinedConversations(anyInt())).thenReturn(ProviderResult.ok(List.of()));

        ProviderResult<ResolvedConversation> result = resolver.resolve(REF);

        assertThat(result.error().kind()).isEqualTo(RelayErrorKind.RESOLUTION_FAILED);
        assertThat(resolver.cachedEntries()).isZero();
    }

    @Test
    void needs_membership_is_not_cached_and_skips_scan() {
        when(providerPort.resolveConversation(REF))
                .thenReturn(ProviderResult.failure(RelayErrorKind.NEEDS_MEMBERSHIP, "CHANNEL_PRIVATE"))
                .thenReturn(ProviderResult.ok(HANDLE));

        ProviderResult<ResolvedConversation> first = resolver.resolve(REF);
        ProviderResult<ResolvedConversation> second = resolver.resolve(REF);

        assertThat(first.error().kind()).isEqualTo(RelayErrorKind.NEEDS_MEMBERSHIP);
        assertThat(second.isOk()).isTrue();
        verify(providerPort, never()).listJoinedConversations(anyInt());
    }

    @Test
    void invalidate_forces_fresh_lookup() {
        when(providerPort.resolveConversation(REF)).thenReturn(ProviderResult.ok(HANDLE));

        resolver.resolve(REF);
        resolver.invalidate(REF);
        resolver.resolve(REF);

        verify(providerPort, times(2)).resolveConversation(REF);
    }

    @Test
    void provider_exception_becomes_fatal() {
        when(providerPort.resolveConversation(any())).thenThrow(new IllegalStateException("boom"));

        ProviderResult<ResolvedConversation> result = resolver.resolve(REF);

        assertThat(result.error().kind()).isEqualTo(RelayErrorKind.FATAL);
    }

    @Test
    void join_caches_joined_conversation() {
        when(providerPort.join("https://t.me/+abc")).thenReturn(ProviderResult.ok(HANDLE));

        ProviderResult<ResolvedConversation> joined = resolver.join("https://t.me/+abc");
        ProviderResult<ResolvedConversation> resolved = resolver.resolve(REF);

        assertThat(joined.value().canonicalId()).isEqualTo(-100123L);
        assertThat(resolved.isOk()).isTrue();
        verify(providerPort, never()).resolveConversation(any());
    }
}
