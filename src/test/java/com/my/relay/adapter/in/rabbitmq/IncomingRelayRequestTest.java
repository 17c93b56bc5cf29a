package com.my.relay.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.my.relay.domain.model.RelayMode;
import com.my.relay.domain.model.RelayRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IncomingRelayRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsRelayPayload() throws Exception {
        String payload = "{" +
                "\"requestId\":\"r-1\"," +
                "\"callerId\":\"user-1\"," +
                "\"targetId\":99," +
                "\"text\":\"https://t.me/c/123/10-12\"," +
                "\"mode\":\"copy\"," +
                "\"extra\":true" +
                "}";

        IncomingRelayRequest incoming = objectMapper.readValue(payload, IncomingRelayRequest.class);
        RelayRequest request = incoming.toRelayRequest();

        assertThat(incoming.requestType()).isEqualTo(IncomingRelayRequest.Type.RELAY);
        assertThat(request.targetId()).isEqualTo(99L);
        assertThat(request.mode()).isEqualTo(RelayMode.COPY);
        assertThat(request.text()).isEqualTo("https://t.me/c/123/10-12");
    }

    @Test
    void rejectsMissingCaller() {
        String payload = "{\"requestId\":\"r-1\",\"type\":\"STATISTICS\"}";

        assertThrows(ValueInstantiationException.class,
                () -> objectMapper.readValue(payload, IncomingRelayRequest.class));
    }

    @Test
    void relayWithoutTargetIsInvalid() throws Exception {
        IncomingRelayRequest incoming = objectMapper.readValue(
                "{\"requestId\":\"r-1\",\"callerId\":\"u\",\"text\":\"x\"}", IncomingRelayRequest.class);

        assertThatThrownBy(incoming::toRelayRequest).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownTypeOrModeIsInvalid() {
        IncomingRelayRequest unknownType = new IncomingRelayRequest("PURGE", "r", "u", 1L, "x", null, null, null);
        IncomingRelayRequest unknownMode = new IncomingRelayRequest("relay", "r", "u", 1L, "x", "teleport", null, null);

        assertThatThrownBy(unknownType::requestType).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(unknownMode::toRelayRequest).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void windowAndIntervalConversions() {
        IncomingRelayRequest request = new IncomingRelayRequest("PACING", "r", "u", null, null, null, 6, 1.5);

        assertThat(request.window(Duration.ofHours(24))).isEqualTo(Duration.ofHours(6));
        assertThat(request.interval()).isEqualTo(Duration.ofMillis(1500));
        assertThat(request.targetOrZero()).isZero();
        assertThatThrownBy(() -> new IncomingRelayRequest("PACING", "r", "u", null, null, null, 0, -1.0).interval())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
