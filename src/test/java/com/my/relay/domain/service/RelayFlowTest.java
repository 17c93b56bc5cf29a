package com.my.relay.domain.service;

import com.my.relay.adapter.out.outcome.InMemoryOutcomeLog;
import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayEvent;
import com.my.relay.domain.model.RelayEventType;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayRequest;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.domain.port.out.ProviderPort;
import com.my.relay.domain.port.out.RelayEventPort;
import com.my.relay.support.ManualClock;
import com.my.relay.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 파서부터 결과 기록까지 실제 서비스들을 연결하고 프로바이더만 모의한 흐름 테스트.
 */
class RelayFlowTest {

    private static final long CONV = -100100500L;
    private static final long TARGET = 42L;
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private ProviderPort providerPort;
    private RelayEventPort eventPort;
    private InMemoryOutcomeLog outcomeLog;
    private RelayService service;

    @BeforeEach
    void setUp() {
        providerPort = mock(ProviderPort.class);
        eventPort = mock(RelayEventPort.class);
        outcomeLog = new InMemoryOutcomeLog();
        ManualClock clock = new ManualClock(START);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        ConversationResolver resolver = new ConversationResolver(providerPort, clock, Duration.ofHours(1), 200);
        PacingController pacing = new PacingController(clock, sleeper,
                Duration.ofSeconds(3), Duration.ofSeconds(1), Duration.ofMinutes(5));
        RelayStrategyEngine engine = new RelayStrategyEngine(providerPort, mock(LocalStoragePort.class), clock, 1_000_000);
        BatchOrchestrator orchestrator = new BatchOrchestrator(resolver, pacing, engine, outcomeLog, clock,
                Duration.ofSeconds(5), 10);
        service = new RelayService(new ReferenceParser(50), orchestrator, resolver, new CallerRegistry(Set.of()),
                eventPort);

        when(providerPort.resolveConversation(ConversationRef.ofId(CONV)))
                .thenReturn(ProviderResult.ok(new ConversationHandle(CONV, "원본", null, false)));
        when(providerPort.relay(eq(CONV), anyLong(), eq(TARGET))).thenReturn(ProviderResult.done());
    }

    @Test
    void internal_link_range_is_relayed_directly_end_to_end() {
        BatchResult result = service.handle(new RelayRequest("req-1", "user-1", TARGET,
                "prov://c/100500/10-12", RelayMode.FORWARD));

        assertThat(result).isEqualTo(new BatchResult(3, 3, 0, 0));
        List<RelayOutcome> outcomes = outcomeLog.query(START);
        assertThat(outcomes).extracting(RelayOutcome::messageId).containsExactly(10L, 11L, 12L);
        assertThat(outcomes).extracting(RelayOutcome::status).containsOnly(RelayStatus.SUCCESS);
        assertThat(outcomes).extracting(RelayOutcome::conversationId).containsOnly(CONV);
        assertThat(outcomes).allMatch(outcome -> outcome.reason().contains("DIRECT_RELAY"));
        verify(providerPort, times(1)).resolveConversation(ConversationRef.ofId(CONV));
        verify(providerPort, never()).fetchMessage(anyLong(), anyLong());
        verify(providerPort, never()).republish(anyLong(), any());
    }

    @Test
    void single_public_link_resolves_then_succeeds_via_direct_relay() {
        ConversationRef byName = ConversationRef.ofUsername("news_channel");
        when(providerPort.resolveConversation(byName))
                .thenReturn(ProviderResult.ok(new ConversationHandle(CONV, "뉴스", "news_channel", false)));

        BatchResult result = service.handle(new RelayRequest("req-2", "user-1", TARGET,
                "https://t.me/news_channel/77", RelayMode.FORWARD));

        assertThat(result).isEqualTo(new BatchResult(1, 1, 0, 0));
        verify(providerPort).relay(CONV, 77, TARGET);
        ArgumentCaptor<RelayEvent> events = ArgumentCaptor.forClass(RelayEvent.class);
        verify(eventPort, atLeastOnce()).publish(events.capture());
        RelayEvent last = events.getValue();
        assertThat(last.type()).isEqualTo(RelayEventType.COMPLETED);
        assertThat(last.tally()).isEqualTo(new BatchResult(1, 1, 0, 0));
    }
}
