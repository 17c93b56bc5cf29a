package com.my.relay.domain.service;

import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.CallerProfile;
import com.my.relay.domain.model.CancellationFlag;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MessageRange;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayAttempt;
import com.my.relay.domain.model.RelayError;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.OutcomeLogPort;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * 왜: 메시지 구간을 오름차순으로 한 건씩 중계하며 결과를 기록하고 집계해, 한 항목의 실패가 배치 전체를 멈추지 않게 하기 위함.
 *
 * <p>다음 항목은 이전 항목의 결과가 로그에 기록된 뒤에만 시도한다. 일시적 오류는 백오프 후 같은 항목을 한 번만 다시 시도한다.
 */
public class BatchOrchestrator {

    private static final Logger log = Logger.getLogger(BatchOrchestrator.class);

    private final ConversationResolver resolver;
    private final PacingController pacing;
    private final RelayStrategyEngine engine;
    private final OutcomeLogPort outcomeLog;
    private final ClockPort clockPort;
    private final Duration defaultBackoff;
    private final int progressEvery;

    public BatchOrchestrator(ConversationResolver resolver,
                             PacingController pacing,
                             RelayStrategyEngine engine,
                             OutcomeLogPort outcomeLog,
                             ClockPort clockPort,
                             Duration defaultBackoff,
                             int progressEvery) {
        if (progressEvery <= 0) {
            throw new IllegalArgumentException("progressEvery는 1 이상이어야 합니다.");
        }
        this.resolver = resolver;
        this.pacing = pacing;
        this.engine = engine;
        this.outcomeLog = outcomeLog;
        this.clockPort = clockPort;
        this.defaultBackoff = defaultBackoff;
        this.progressEvery = progressEvery;
    }

    public BatchResult process(MessageRange range, long targetId, CallerProfile caller) {
        return process(range, targetId, caller, RelayMode.FORWARD, new CancellationFlag(), BatchListener.NONE);
    }

    public BatchResult process(MessageRange range,
                               long targetId,
                               CallerProfile caller,
                               RelayMode mode,
                               CancellationFlag cancellation,
                               BatchListener listener) {
        ConversationRef ref = range.conversation();
        ProviderResult<ResolvedConversation> initial = resolveWithBackoff(ref, 0L, listener);
        if (!initial.isOk()) {
            RelayError error = initial.error();
            listener.onRejected(error.kind(), rejectionMessage(ref, error));
            return BatchResult.rejected(range.size());
        }

        long conversationId = initial.value().canonicalId();
        int total = range.size();
        int processed = 0;
        BatchResult tally = BatchResult.EMPTY;
        for (long messageId : range.ids()) {
            if (cancellation.isCancelled()) {
                log.infof("배치 취소 caller=%s processed=%d/%d", caller.id(), processed, total);
                listener.onCancelled(processed, total, tally);
                break;
            }
            RelayOutcome outcome = processItem(ref, conversationId, messageId, targetId, caller, mode, listener);
            record(outcome);
            caller.recordResult(outcome.isSuccess());
            tally = tally.plus(outcome);
            processed++;
            if (processed % progressEvery == 0 && processed < total) {
                listener.onProgress(processed, total, tally);
            }
        }
        log.infof("배치 완료 caller=%s conv=%d total=%d success=%d failed=%d restricted=%d",
                caller.id(), conversationId, tally.total(), tally.successful(), tally.failed(), tally.restrictedCount());
        return tally;
    }

    private RelayOutcome processItem(ConversationRef ref,
                                     long conversationId,
                                     long messageId,
                                     long targetId,
                                     CallerProfile caller,
                                     RelayMode mode,
                                     BatchListener listener) {
        ProviderResult<ResolvedConversation> conversation = resolveWithBackoff(ref, messageId, listener);
        if (!conversation.isOk()) {
            return failure(conversationId, messageId, targetId, conversation.error());
        }
        pacing.waitTurn(caller);
        RelayAttempt attempt = attempt(conversation.value(), messageId, targetId, mode);
        if (attempt.isTransient()) {
            Duration advised = attempt.lastFailure().flatMap(RelayError::advisedWait).orElse(defaultBackoff);
            listener.onBackoff(messageId, pacing.cap(advised));
            pacing.onProviderBackoff(advised);
            pacing.waitTurn(caller);
            attempt = attempt(conversation.value(), messageId, targetId, mode);
        }
        attempt.lastFailure()
                .filter(error -> error.kind().isResolutionClass())
                .ifPresent(error -> resolver.invalidate(ref));
        return attempt.outcome();
    }

    private RelayAttempt attempt(ResolvedConversation conversation, long messageId, long targetId, RelayMode mode) {
        try {
            return engine.relay(conversation, messageId, targetId, mode);
        } catch (RuntimeException e) {
            log.errorf(e, "중계 중 예외 conv=%d msg=%d", conversation.canonicalId(), messageId);
            RelayError error = RelayError.of(RelayErrorKind.FATAL, "예상하지 못한 오류: " + e.getMessage());
            return RelayAttempt.failed(failure(conversation.canonicalId(), messageId, targetId, error), error);
        }
    }

    /**
     * 캐시가 비어 있을 때의 해석도 일시적 오류면 전역 백오프 후 한 번만 다시 시도한다.
     */
    private ProviderResult<ResolvedConversation> resolveWithBackoff(ConversationRef ref,
                                                                    long messageId,
                                                                    BatchListener listener) {
        ProviderResult<ResolvedConversation> resolved = resolver.resolve(ref);
        if (resolved.isOk() || resolved.error().kind() != RelayErrorKind.TRANSIENT) {
            return resolved;
        }
        Duration advised = resolved.error().advisedWait().orElse(defaultBackoff);
        listener.onBackoff(messageId, pacing.cap(advised));
        pacing.onProviderBackoff(advised);
        return resolver.resolve(ref);
    }

    private void record(RelayOutcome outcome) {
        try {
            outcomeLog.append(outcome);
        } catch (RuntimeException e) {
            log.errorf(e, "처리 결과 기록 실패 conv=%d msg=%d status=%s",
                    outcome.conversationId(), outcome.messageId(), outcome.status());
        }
    }

    private RelayOutcome failure(long conversationId, long messageId, long targetId, RelayError error) {
        RelayStatus status = error.kind().toStatus();
        return new RelayOutcome(conversationId, messageId, targetId, status,
                error.kind() + ": " + error.detail(), clockPort.now());
    }

    private static String rejectionMessage(ConversationRef ref, RelayError error) {
        if (error.kind() == RelayErrorKind.NEEDS_MEMBERSHIP) {
            return "비공개 대화입니다. 초대 링크로 먼저 가입해주세요: " + ref;
        }
        return "대화를 찾을 수 없습니다: " + ref + " (" + error.detail() + ")";
    }
}
