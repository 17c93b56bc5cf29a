package com.my.relay.domain.service;

import com.my.relay.domain.exception.InvalidReferenceException;
import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.CallerProfile;
import com.my.relay.domain.model.CancellationFlag;
import com.my.relay.domain.model.MessageRange;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.RelayEvent;
import com.my.relay.domain.model.RelayEventType;
import com.my.relay.domain.model.RelayRequest;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.in.CancelRelayUseCase;
import com.my.relay.domain.port.in.HandleReferenceUseCase;
import com.my.relay.domain.port.in.JoinConversationUseCase;
import com.my.relay.domain.port.out.RelayEventPort;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 참조 해석, 배치 실행, 진행 이벤트 발행을 호스트 계층의 단일 진입점으로 묶기 위함.
 *
 * <p>같은 호출자의 요청은 호출자 락으로 순차 실행되고, 다른 호출자의 배치는 동시에 진행될 수 있다.
 */
public class RelayService implements HandleReferenceUseCase, CancelRelayUseCase, JoinConversationUseCase {

    private final ReferenceParser parser;
    private final BatchOrchestrator orchestrator;
    private final ConversationResolver resolver;
    private final CallerRegistry callerRegistry;
    private final RelayEventPort eventPort;
    private final Map<String, CancellationFlag> activeBatches = new ConcurrentHashMap<>();

    public RelayService(ReferenceParser parser,
                        BatchOrchestrator orchestrator,
                        ConversationResolver resolver,
                        CallerRegistry callerRegistry,
                        RelayEventPort eventPort) {
        this.parser = parser;
        this.orchestrator = orchestrator;
        this.resolver = resolver;
        this.callerRegistry = callerRegistry;
        this.eventPort = eventPort;
    }

    @Override
    public BatchResult handle(RelayRequest request) {
        List<MessageRange> ranges;
        try {
            ranges = parser.parseAll(request.text());
        } catch (InvalidReferenceException e) {
            eventPort.publish(RelayEvent.rejected(request, e.kind(), BatchResult.EMPTY,
                    "❌ 올바른 링크를 찾지 못했습니다. 예: https://t.me/c/123456789/100, https://t.me/username/100, -100123456789/100"));
            return BatchResult.EMPTY;
        }

        int total = ranges.stream().mapToInt(MessageRange::size).sum();
        for (MessageRange range : ranges) {
            if (range.clamped()) {
                eventPort.publish(RelayEvent.of(request, RelayEventType.NOTICE, 0, total, BatchResult.EMPTY,
                        "⚠️ 요청한 " + range.requestedSize() + "개 중 처음 " + range.size() + "개만 처리합니다. ("
                                + range.conversation() + "/" + range.startId() + "-" + range.endId() + ")"));
            }
        }

        CallerProfile caller = callerRegistry.profile(request.callerId());
        CancellationFlag cancellation = new CancellationFlag();
        caller.batchLock().lock();
        activeBatches.put(caller.id(), cancellation);
        try {
            BatchResult result = BatchResult.EMPTY;
            int offset = 0;
            for (MessageRange range : ranges) {
                if (cancellation.isCancelled()) {
                    break;
                }
                EventBatchListener listener = new EventBatchListener(request, offset, total, result);
                result = result.plus(orchestrator.process(range, request.targetId(), caller,
                        request.mode(), cancellation, listener));
                offset += range.size();
            }
            eventPort.publish(RelayEvent.of(request, RelayEventType.COMPLETED, result.total(), total, result,
                    "✅ 처리 완료: 성공 " + result.successful() + " / 실패 " + result.failed()
                            + " / 제한 " + result.restrictedCount()));
            return result;
        } finally {
            activeBatches.remove(caller.id(), cancellation);
            caller.batchLock().unlock();
        }
    }

    @Override
    public boolean cancel(String callerId) {
        CancellationFlag flag = activeBatches.get(callerId);
        if (flag == null) {
            return false;
        }
        flag.cancel();
        return true;
    }

    @Override
    public ProviderResult<ResolvedConversation> join(String inviteOrRef) {
        if (inviteOrRef == null || inviteOrRef.isBlank()) {
            return ProviderResult.failure(RelayErrorKind.INVALID_FORMAT, "초대 링크가 비어 있습니다.");
        }
        return resolver.join(inviteOrRef.trim());
    }

    /**
     * 여러 구간을 하나의 요청으로 처리할 때 진행 수치를 요청 전체 기준으로 환산해 이벤트로 내보낸다.
     */
    private final class EventBatchListener implements BatchListener {

        private final RelayRequest request;
        private final int offset;
        private final int total;
        private final BatchResult before;

        private EventBatchListener(RelayRequest request, int offset, int total, BatchResult before) {
            this.request = request;
            this.offset = offset;
            this.total = total;
            this.before = before;
        }

        @Override
        public void onProgress(int processed, int rangeTotal, BatchResult tally) {
            BatchResult running = before.plus(tally);
            eventPort.publish(RelayEvent.of(request, RelayEventType.PROGRESS, offset + processed, total, running,
                    "🔄 진행 중 " + (offset + processed) + "/" + total
                            + " (성공 " + running.successful() + ", 실패 " + running.failed() + ")"));
        }

        @Override
        public void onBackoff(long messageId, Duration wait) {
            eventPort.publish(RelayEvent.of(request, RelayEventType.BACKOFF, offset, total, before,
                    "⚠️ 요청이 제한되었습니다. " + wait.toSeconds() + "초 대기 후 다시 시도합니다."));
        }

        @Override
        public void onRejected(RelayErrorKind kind, String detail) {
            eventPort.publish(RelayEvent.rejected(request, kind, before, detail));
        }

        @Override
        public void onCancelled(int processed, int rangeTotal, BatchResult tally) {
            BatchResult running = before.plus(tally);
            eventPort.publish(RelayEvent.of(request, RelayEventType.CANCELLED, offset + processed, total, running,
                    "⏹️ 요청이 취소되었습니다. " + (offset + processed) + "/" + total + " 처리됨"));
        }
    }
}
