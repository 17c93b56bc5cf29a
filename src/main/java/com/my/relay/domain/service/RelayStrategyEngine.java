package com.my.relay.domain.service;

import com.my.relay.domain.model.MediaDescriptor;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayAttempt;
import com.my.relay.domain.model.RelayError;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.model.RelayStrategy;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.domain.port.out.ProviderPort;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 왜: 메시지 한 건을 정해진 순서의 전략 표에 따라 재현하고, 모두 실패하면 마지막 실패를 분류해 결과로 남기기 위함.
 *
 * <p>전략 표는 고정 순서이며 정적 전제 조건(제한된 대화면 직접 중계 생략, 모드)으로 먼저 걸러진 뒤 순회한다.
 * 일시적 오류는 즉시 시도를 중단하고, 메시지 없음과 크기 초과는 해당 항목의 최종 결과가 된다.
 */
public class RelayStrategyEngine {

    private static final Logger log = Logger.getLogger(RelayStrategyEngine.class);

    private static final Set<RelayErrorKind> TERMINAL = EnumSet.of(RelayErrorKind.NOT_FOUND, RelayErrorKind.TOO_LARGE);

    private final ProviderPort providerPort;
    private final LocalStoragePort localStoragePort;
    private final ClockPort clockPort;
    private final long maxMediaBytes;
    private final List<StrategyEntry> strategies;

    public RelayStrategyEngine(ProviderPort providerPort,
                               LocalStoragePort localStoragePort,
                               ClockPort clockPort,
                               long maxMediaBytes) {
        this.providerPort = providerPort;
        this.localStoragePort = localStoragePort;
        this.clockPort = clockPort;
        this.maxMediaBytes = maxMediaBytes;
        this.strategies = List.of(
                new StrategyEntry(RelayStrategy.DIRECT_RELAY, EnumSet.of(RelayMode.FORWARD),
                        ctx -> !ctx.conversation().restricted(), this::directRelay),
                new StrategyEntry(RelayStrategy.RE_EMISSION, EnumSet.of(RelayMode.FORWARD, RelayMode.COPY),
                        ctx -> true, this::reEmit),
                new StrategyEntry(RelayStrategy.FETCH_THEN_REPUBLISH, EnumSet.of(RelayMode.FORWARD, RelayMode.COPY),
                        ctx -> true, this::fetchThenRepublish),
                new StrategyEntry(RelayStrategy.ARCHIVE, EnumSet.of(RelayMode.DOWNLOAD),
                        ctx -> true, this::archive)
        );
    }

    public RelayAttempt relay(ResolvedConversation conversation, long messageId, long targetId, RelayMode mode) {
        RelayContext ctx = new RelayContext(conversation, messageId, targetId);
        List<StrategyEntry> applicable = strategies.stream()
                .filter(entry -> entry.modes().contains(mode) && entry.precondition().test(ctx))
                .toList();

        RelayError last = null;
        RelayStrategy lastStrategy = null;
        for (StrategyEntry entry : applicable) {
            StepResult result = entry.step().attempt(ctx);
            if (result.skipped()) {
                continue;
            }
            if (result.succeeded()) {
                log.debugf("중계 성공 conv=%d msg=%d strategy=%s", conversation.canonicalId(), messageId, entry.strategy());
                return RelayAttempt.succeeded(outcome(ctx, RelayStatus.SUCCESS, entry.strategy().name()), entry.strategy());
            }
            RelayError error = result.error();
            log.debugf("전략 실패 conv=%d msg=%d strategy=%s kind=%s detail=%s",
                    conversation.canonicalId(), messageId, entry.strategy(), error.kind(), error.detail());
            if (error.kind() == RelayErrorKind.TRANSIENT || TERMINAL.contains(error.kind())) {
                return RelayAttempt.failed(outcome(ctx, error.kind().toStatus(), reason(entry.strategy(), error)), error);
            }
            last = error;
            lastStrategy = entry.strategy();
        }

        if (last == null) {
            last = RelayError.of(RelayErrorKind.FATAL, "적용 가능한 전략이 없습니다.");
        }
        RelayStatus status = last.kind() == RelayErrorKind.RESTRICTED ? RelayStatus.RESTRICTED : RelayStatus.FATAL_ERROR;
        return RelayAttempt.failed(outcome(ctx, status, reason(lastStrategy, last)), last);
    }

    private StepResult directRelay(RelayContext ctx) {
        return StepResult.of(ProviderCall.guarded(() ->
                providerPort.relay(ctx.conversation().canonicalId(), ctx.messageId(), ctx.targetId())));
    }

    /**
     * 텍스트는 그대로, 미디어는 프로바이더가 가진 사본을 참조해 전달 표시 없이 다시 게시한다.
     */
    private StepResult reEmit(RelayContext ctx) {
        ProviderResult<MessageContent> content = ctx.content();
        if (!content.isOk()) {
            return StepResult.failed(content.error());
        }
        if (content.value().isEmpty()) {
            return StepResult.failed(RelayError.of(RelayErrorKind.FATAL, "재현할 내용이 없는 메시지입니다."));
        }
        return StepResult.of(ProviderCall.guarded(() -> providerPort.republish(ctx.targetId(), content.value())));
    }

    /**
     * 미디어를 임시 저장소에 내려받아 게시한다. 로컬 사본은 게시 결과와 관계없이 삭제한다.
     */
    private StepResult fetchThenRepublish(RelayContext ctx) {
        ProviderResult<MessageContent> content = ctx.content();
        if (!content.isOk() || !content.value().hasMedia()) {
            return StepResult.SKIPPED;
        }
        MessageContent message = content.value();
        StepResult tooLarge = checkSize(message.media());
        if (tooLarge != null) {
            return tooLarge;
        }
        ProviderResult<Path> download = ProviderCall.guarded(() ->
                providerPort.downloadToLocal(message.media(), localStoragePort.transientDirectory()));
        if (!download.isOk()) {
            return StepResult.failed(download.error());
        }
        Path localPath = download.value();
        try {
            return StepResult.of(ProviderCall.guarded(() ->
                    providerPort.publishLocal(ctx.targetId(), localPath, message.effectiveCaption())));
        } finally {
            if (!localStoragePort.delete(localPath)) {
                log.warnf("임시 파일 삭제 실패: %s", localPath);
            }
        }
    }

    /**
     * DOWNLOAD 모드 전용. 미디어를 보관 디렉터리에 내려받아 남겨 둔다.
     */
    private StepResult archive(RelayContext ctx) {
        ProviderResult<MessageContent> content = ctx.content();
        if (!content.isOk()) {
            return StepResult.failed(content.error());
        }
        if (!content.value().hasMedia()) {
            return StepResult.failed(RelayError.of(RelayErrorKind.FATAL, "보관할 미디어가 없는 메시지입니다."));
        }
        MediaDescriptor media = content.value().media();
        StepResult tooLarge = checkSize(media);
        if (tooLarge != null) {
            return tooLarge;
        }
        ProviderResult<Path> download = ProviderCall.guarded(() ->
                providerPort.downloadToLocal(media, localStoragePort.archiveDirectory()));
        if (download.isOk()) {
            log.infof("미디어 보관 완료: %s", download.value());
        }
        return download.isOk() ? StepResult.SUCCEEDED : StepResult.failed(download.error());
    }

    private StepResult checkSize(MediaDescriptor media) {
        if (media.sizeBytes() > maxMediaBytes) {
            return StepResult.failed(RelayError.of(RelayErrorKind.TOO_LARGE,
                    "미디어 크기 " + media.sizeBytes() + " bytes가 상한 " + maxMediaBytes + " bytes를 넘습니다."));
        }
        return null;
    }

    private RelayOutcome outcome(RelayContext ctx, RelayStatus status, String reason) {
        return new RelayOutcome(ctx.conversation().canonicalId(), ctx.messageId(), ctx.targetId(),
                status, reason, clockPort.now());
    }

    private static String reason(RelayStrategy strategy, RelayError error) {
        return strategy == null ? error.detail() : strategy.name() + ": " + error.detail();
    }

    /**
     * 한 번의 중계 시도 동안 메시지 조회 결과를 재사용하기 위한 문맥.
     */
    private final class RelayContext {

        private final ResolvedConversation conversation;
        private final long messageId;
        private final long targetId;
        private ProviderResult<MessageContent> content;

        private RelayContext(ResolvedConversation conversation, long messageId, long targetId) {
            this.conversation = conversation;
            this.messageId = messageId;
            this.targetId = targetId;
        }

        ResolvedConversation conversation() {
            return conversation;
        }

        long messageId() {
            return messageId;
        }

        long targetId() {
            return targetId;
        }

        ProviderResult<MessageContent> content() {
            if (content == null) {
                content = ProviderCall.guarded(() -> providerPort.fetchMessage(conversation.canonicalId(), messageId));
            }
            return content;
        }
    }

    @FunctionalInterface
    private interface StrategyStep {
        StepResult attempt(RelayContext ctx);
    }

    private record StrategyEntry(RelayStrategy strategy,
                                 Set<RelayMode> modes,
                                 Predicate<RelayContext> precondition,
                                 StrategyStep step) {
    }

    private record StepResult(boolean skipped, RelayError error) {

        static final StepResult SUCCEEDED = new StepResult(false, null);
        static final StepResult SKIPPED = new StepResult(true, null);

        static StepResult failed(RelayError error) {
            return new StepResult(false, error);
        }

        static StepResult of(ProviderResult<?> result) {
            return result.isOk() ? SUCCEEDED : failed(result.error());
        }

        boolean succeeded() {
            return !skipped && error == null;
        }
    }
}
