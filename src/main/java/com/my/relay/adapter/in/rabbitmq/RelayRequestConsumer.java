package com.my.relay.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.RelayEvent;
import com.my.relay.domain.model.RelayEventType;
import com.my.relay.domain.model.RelayStatistics;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.in.CancelRelayUseCase;
import com.my.relay.domain.port.in.HandleReferenceUseCase;
import com.my.relay.domain.port.in.JoinConversationUseCase;
import com.my.relay.domain.port.in.RelayStatisticsUseCase;
import com.my.relay.domain.port.in.UpdatePacingUseCase;
import com.my.relay.domain.port.out.RelayEventPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.time.Duration;

/**
 * 왜: RabbitMQ 요청을 종류별 유스케이스로 보내는 단일 진입 경로를 제공하기 위함.
 *
 * <p>순서 보장 없이 처리해 실행 중인 배치가 같은 호출자의 CANCEL 요청을 막지 않게 한다.
 */
@ApplicationScoped
public class RelayRequestConsumer {

    private static final Logger log = Logger.getLogger(RelayRequestConsumer.class);

    private final HandleReferenceUseCase handleReferenceUseCase;
    private final JoinConversationUseCase joinConversationUseCase;
    private final RelayStatisticsUseCase relayStatisticsUseCase;
    private final CancelRelayUseCase cancelRelayUseCase;
    private final UpdatePacingUseCase updatePacingUseCase;
    private final RelayEventPort relayEventPort;
    private final ObjectMapper objectMapper;
    private final Duration defaultStatisticsWindow;

    @Inject
    public RelayRequestConsumer(HandleReferenceUseCase handleReferenceUseCase,
                                JoinConversationUseCase joinConversationUseCase,
                                RelayStatisticsUseCase relayStatisticsUseCase,
                                CancelRelayUseCase cancelRelayUseCase,
                                UpdatePacingUseCase updatePacingUseCase,
                                RelayEventPort relayEventPort,
                                ObjectMapper objectMapper,
                                AppConfig appConfig) {
        this.handleReferenceUseCase = handleReferenceUseCase;
        this.joinConversationUseCase = joinConversationUseCase;
        this.relayStatisticsUseCase = relayStatisticsUseCase;
        this.cancelRelayUseCase = cancelRelayUseCase;
        this.updatePacingUseCase = updatePacingUseCase;
        this.relayEventPort = relayEventPort;
        this.objectMapper = objectMapper;
        this.defaultStatisticsWindow = appConfig.orchestrator().statisticsWindow();
    }

    @Incoming("relay-requests")
    @Blocking(ordered = false)
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            dispatch(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void dispatch(String payload) {
        IncomingRelayRequest incoming;
        try {
            incoming = objectMapper.readValue(payload, IncomingRelayRequest.class);
        } catch (IOException | IllegalArgumentException e) {
            log.warnf("요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("requestId", incoming.requestId());
        MDC.put("callerId", incoming.callerId());
        try {
            switch (incoming.requestType()) {
                case RELAY -> handleReferenceUseCase.handle(incoming.toRelayRequest());
                case JOIN -> join(incoming);
                case STATISTICS -> statistics(incoming);
                case CANCEL -> cancel(incoming);
                case PACING -> pacing(incoming);
            }
        } catch (IllegalArgumentException e) {
            log.warnf("요청 검증 실패로 처리 중단: %s", e.getMessage());
            reply(incoming, RelayEventType.REJECTED, RelayErrorKind.INVALID_FORMAT, "❌ " + e.getMessage());
        } catch (RuntimeException e) {
            log.errorf(e, "요청 처리 중 예외 type=%s", incoming.type());
            reply(incoming, RelayEventType.REJECTED, RelayErrorKind.FATAL, "❌ 처리 중 오류가 발생했습니다.");
        } finally {
            MDC.remove("requestId");
            MDC.remove("callerId");
        }
    }

    private void join(IncomingRelayRequest incoming) {
        ProviderResult<ResolvedConversation> joined = joinConversationUseCase.join(incoming.text());
        if (joined.isOk()) {
            reply(incoming, RelayEventType.NOTICE, null,
                    "✅ 가입 완료: " + joined.value().displayName() + " (" + joined.value().canonicalId() + ")");
        } else {
            reply(incoming, RelayEventType.REJECTED, joined.error().kind(), "❌ 가입 실패: " + joined.error().detail());
        }
    }

    private void statistics(IncomingRelayRequest incoming) {
        RelayStatistics stats = relayStatisticsUseCase.statistics(incoming.window(defaultStatisticsWindow));
        String text = "📊 최근 " + stats.window().toHours() + "시간 통계\n"
                + "전체: " + stats.total() + "\n"
                + "성공: " + stats.successful() + "\n"
                + "실패: " + stats.failed() + "\n"
                + "제한: " + stats.count(RelayStatus.RESTRICTED) + "\n"
                + "보관 파일: " + stats.archivedFiles();
        reply(incoming, RelayEventType.NOTICE, null, text);
    }

    private void cancel(IncomingRelayRequest incoming) {
        boolean cancelled = cancelRelayUseCase.cancel(incoming.callerId());
        reply(incoming, RelayEventType.NOTICE, null,
                cancelled ? "⏹️ 진행 중인 작업에 취소를 요청했습니다." : "진행 중인 작업이 없습니다.");
    }

    private void pacing(IncomingRelayRequest incoming) {
        Duration applied = updatePacingUseCase.updateStandardInterval(incoming.interval());
        reply(incoming, RelayEventType.NOTICE, null, "⏱️ 작업 간격을 " + applied.toMillis() + "ms로 변경했습니다.");
    }

    private void reply(IncomingRelayRequest incoming, RelayEventType type, RelayErrorKind kind, String text) {
        relayEventPort.publish(new RelayEvent(incoming.requestId(), incoming.callerId(), incoming.targetOrZero(),
                type, 0, 0, BatchResult.EMPTY, kind, text));
    }
}
