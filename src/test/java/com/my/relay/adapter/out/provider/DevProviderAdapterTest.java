package com.my.relay.adapter.out.provider;

import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DevProviderAdapterTest {

    @TempDir
    Path tempDir;

    private final DevProviderAdapter adapter = new DevProviderAdapter();

    @Test
    void restricted_conversation_refuses_direct_relay() {
        assertThat(adapter.resolveConversation(ConversationRef.ofUsername("dev_restricted")).value().restricted()).isTrue();

        ProviderResult<Void> result = adapter.relay(DevProviderAdapter.RESTRICTED_ID, 1, 10);

        assertThat(result.error().kind()).isEqualTo(RelayErrorKind.RESTRICTED);
        assertThat(adapter.published()).isEmpty();
    }

    @Test
    void every_fifth_message_has_media_that_can_be_downloaded() throws Exception {
        MessageContent content = adapter.fetchMessage(DevProviderAdapter.PUBLIC_ID, 10).value();

        Path local = adapter.downloadToLocal(content.media(), tempDir).value();

        assertThat(Files.readString(local)).contains(content.media().reference());
        assertThat(adapter.publishLocal(1L, local, content.effectiveCaption()).isOk()).isTrue();
        assertThat(adapter.published()).hasSize(1);
    }

    @Test
    void unknown_references_fail_like_a_provider() {
        assertThat(adapter.resolveConversation(ConversationRef.ofId(-1L)).error().kind())
                .isEqualTo(RelayErrorKind.RESOLUTION_FAILED);
        assertThat(adapter.fetchMessage(DevProviderAdapter.PUBLIC_ID, 10_000).error().kind())
                .isEqualTo(RelayErrorKind.NOT_FOUND);
    }

    @Test
    void join_adds_conversation_to_joined_list() {
        long id = adapter.join("https://t.me/+invite").value().id();

        assertThat(adapter.listJoinedConversations(10).value()).anyMatch(handle -> handle.id() == id);
    }
}
