package com.my.relay.domain.service;

import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MediaDescriptor;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayAttempt;
import com.my.relay.domain.model.RelayError;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.model.RelayStrategy;
import com.my.relay.domain.model.ResolvedConversation;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.domain.port.out.ProviderPort;
import com.my.relay.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelayStrategyEngineTest {

    private static final long CONV = -100500L;
    private static final long TARGET = 777L;
    private static final Path TRANSIENT_DIR = Path.of("/tmp/relay-downloads");
    private static final Path ARCHIVE_DIR = Path.of("/tmp/relay-archive");
    private static final MediaDescriptor PHOTO = new MediaDescriptor("ref-1", "photo.jpg", "image/jpeg", 1_000);

    private ProviderPort providerPort;
    private LocalStoragePort storagePort;
    private RelayStrategyEngine engine;

    @BeforeEach
    void setUp() {
        providerPort = mock(ProviderPort.class);
        storagePort = mock(LocalStoragePort.class);
        when(storagePort.transientDirectory()).thenReturn(TRANSIENT_DIR);
        when(storagePort.archiveDirectory()).thenReturn(ARCHIVE_DIR);
        when(storagePort.delete(any())).thenReturn(true);
        engine = new RelayStrategyEngine(providerPort, storagePort, ManualClock.startingAt("2026-01-01T00:00:00Z"), 10_000);
    }

    @Test
    void direct_relay_succeeds_first() {
        when(providerPort.relay(CONV, 10, TARGET)).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(false), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.SUCCESS);
        assertThat(attempt.strategy()).isEqualTo(RelayStrategy.DIRECT_RELAY);
        verify(providerPort, never()).fetchMessage(anyLong(), anyLong());
    }

    @Test
    void restricted_conversation_never_calls_direct_relay() {
        when(providerPort.fetchMessage(CONV, 10)).thenReturn(ProviderResult.ok(MessageContent.text("안녕")));
        when(providerPort.republish(eq(TARGET), any())).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(true), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.isSuccess()).isTrue();
        assertThat(attempt.strategy()).isEqualTo(RelayStrategy.RE_EMISSION);
        verify(providerPort, never()).relay(anyLong(), anyLong(), anyLong());
    }

    @Test
    void restricted_relay_falls_back_to_re_emission() {
        when(providerPort.relay(CONV, 10, TARGET))
                .thenReturn(ProviderResult.failure(RelayErrorKind.RESTRICTED, "CHAT_FORWARDS_RESTRICTED"));
        when(providerPort.fetchMessage(CONV, 10)).thenReturn(ProviderResult.ok(MessageContent.text("본문")));
        when(providerPort.republish(TARGET, MessageContent.text("본문"))).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(false), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.SUCCESS);
        assertThat(attempt.outcome().reason()).isEqualTo("RE_EMISSION");
    }

    @Test
    void copy_mode_skips_direct_relay() {
        when(providerPort.fetchMessage(CONV, 3)).thenReturn(ProviderResult.ok(MessageContent.text("x")));
        when(providerPort.republish(eq(TARGET), any())).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(false), 3, TARGET, RelayMode.COPY);

        assertThat(attempt.strategy()).isEqualTo(RelayStrategy.RE_EMISSION);
        verify(providerPort, never()).relay(anyLong(), anyLong(), anyLong());
    }

    @Test
    void media_falls_back_to_download_and_cleans_up() {
        Path local = TRANSIENT_DIR.resolve("photo.jpg");
        MessageContent content = MessageContent.media(PHOTO, "캡션");
        when(providerPort.fetchMessage(CONV, 10)).thenReturn(ProviderResult.ok(content));
        when(providerPort.republish(TARGET, content))
                .thenReturn(ProviderResult.failure(RelayErrorKind.RESTRICTED, "CHAT_FORWARDS_RESTRICTED"));
        when(providerPort.downloadToLocal(PHOTO, TRANSIENT_DIR)).thenReturn(ProviderResult.ok(local));
        when(providerPort.publishLocal(TARGET, local, "캡션")).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(true), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.strategy()).isEqualTo(RelayStrategy.FETCH_THEN_REPUBLISH);
        verify(storagePort).delete(local);
        verify(providerPort).fetchMessage(CONV, 10);
    }

    @Test
    void local_copy_is_removed_even_when_publish_fails() {
        Path local = TRANSIENT_DIR.resolve("photo.jpg");
        MessageContent content = MessageContent.media(PHOTO, null);
        when(providerPort.fetchMessage(CONV, 10)).thenReturn(ProviderResult.ok(content));
        when(providerPort.republish(TARGET, content)).thenReturn(ProviderResult.failure(RelayErrorKind.FATAL, "MEDIA_INVALID"));
        when(providerPort.downloadToLocal(PHOTO, TRANSIENT_DIR)).thenReturn(ProviderResult.ok(local));
        when(providerPort.publishLocal(TARGET, local, ""))
                .thenReturn(ProviderResult.failure(RelayErrorKind.RESTRICTED, "CHAT_SEND_MEDIA_FORBIDDEN"));

        RelayAttempt attempt = engine.relay(conversation(true), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.RESTRICTED);
        assertThat(attempt.outcome().reason()).startsWith("FETCH_THEN_REPUBLISH");
        verify(storagePort).delete(local);
    }

    @Test
    void oversized_media_is_too_large_without_download() {
        MediaDescriptor video = new MediaDescriptor("ref-2", "video.mp4", "video/mp4", 50_000);
        MessageContent content = MessageContent.media(video, null);
        when(providerPort.fetchMessage(CONV, 11)).thenReturn(ProviderResult.ok(content));
        when(providerPort.republish(TARGET, content)).thenReturn(ProviderResult.failure(RelayErrorKind.RESTRICTED, "no"));

        RelayAttempt attempt = engine.relay(conversation(true), 11, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.TOO_LARGE);
        verify(providerPort, never()).downloadToLocal(any(), any());
    }

    @Test
    void transient_error_aborts_remaining_strategies() {
        RelayError flood = RelayError.throttled(Duration.ofSeconds(35), "FLOOD_WAIT_35");
        when(providerPort.relay(CONV, 10, TARGET)).thenReturn(ProviderResult.failure(flood));

        RelayAttempt attempt = engine.relay(conversation(false), 10, TARGET, RelayMode.FORWARD);

        assertThat(attempt.isTransient()).isTrue();
        assertThat(attempt.lastFailure()).contains(flood);
        verify(providerPort, never()).fetchMessage(anyLong(), anyLong());
    }

    @Test
    void missing_message_is_not_found() {
        when(providerPort.relay(CONV, 99, TARGET)).thenReturn(ProviderResult.failure(RelayErrorKind.FATAL, "BAD"));
        when(providerPort.fetchMessage(CONV, 99)).thenReturn(ProviderResult.failure(RelayErrorKind.NOT_FOUND, "MESSAGE_ID_INVALID"));

        RelayAttempt attempt = engine.relay(conversation(false), 99, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.NOT_FOUND);
    }

    @Test
    void unclassified_failures_end_as_fatal() {
        when(providerPort.relay(CONV, 5, TARGET)).thenReturn(ProviderResult.failure(RelayErrorKind.RESTRICTED, "R"));
        when(providerPort.fetchMessage(CONV, 5)).thenReturn(ProviderResult.ok(MessageContent.text("t")));
        when(providerPort.republish(eq(TARGET), any())).thenReturn(ProviderResult.failure(RelayErrorKind.FATAL, "UNKNOWN"));

        RelayAttempt attempt = engine.relay(conversation(false), 5, TARGET, RelayMode.FORWARD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.FATAL_ERROR);
        assertThat(attempt.outcome().reason()).isEqualTo("RE_EMISSION: UNKNOWN");
    }

    @Test
    void empty_message_cannot_be_re_emitted() {
        when(providerPort.fetchMessage(CONV, 6)).thenReturn(ProviderResult.ok(new MessageContent(" ", null, null)));

        RelayAttempt attempt = engine.relay(conversation(true), 6, TARGET, RelayMode.COPY);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.FATAL_ERROR);
        verify(providerPort, never()).republish(anyLong(), any());
    }

    @Test
    void download_mode_archives_media() {
        Path archived = ARCHIVE_DIR.resolve("photo.jpg");
        when(providerPort.fetchMessage(CONV, 8)).thenReturn(ProviderResult.ok(MessageContent.media(PHOTO, null)));
        when(providerPort.downloadToLocal(PHOTO, ARCHIVE_DIR)).thenReturn(ProviderResult.ok(archived));

        RelayAttempt attempt = engine.relay(conversation(false), 8, TARGET, RelayMode.DOWNLOAD);

        assertThat(attempt.strategy()).isEqualTo(RelayStrategy.ARCHIVE);
        verify(storagePort, never()).delete(any());
        verify(providerPort, never()).relay(anyLong(), anyLong(), anyLong());
    }

    @Test
    void download_mode_without_media_fails() {
        when(providerPort.fetchMessage(CONV, 9)).thenReturn(ProviderResult.ok(MessageContent.text("글")));

        RelayAttempt attempt = engine.relay(conversation(false), 9, TARGET, RelayMode.DOWNLOAD);

        assertThat(attempt.outcome().status()).isEqualTo(RelayStatus.FATAL_ERROR);
    }

    @Test
    void provider_exception_is_treated_as_failed_step() {
        when(providerPort.relay(CONV, 4, TARGET)).thenThrow(new IllegalStateException("socket closed"));
        when(providerPort.fetchMessage(CONV, 4)).thenReturn(ProviderResult.ok(MessageContent.text("t")));
        when(providerPort.republish(eq(TARGET), any())).thenReturn(ProviderResult.done());

        RelayAttempt attempt = engine.relay(conversation(false), 4, TARGET, RelayMode.FORWARD);

        assertThat(attempt.isSuccess()).isTrue();
    }

    private static ResolvedConversation conversation(boolean restricted) {
        return new ResolvedConversation(ConversationRef.ofId(CONV), CONV, "원본", Instant.parse("2026-01-01T00:00:00Z"),
                restricted);
    }
}
