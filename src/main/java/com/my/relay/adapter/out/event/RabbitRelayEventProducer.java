package com.my.relay.adapter.out.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.domain.model.RelayEvent;
import com.my.relay.domain.port.out.RelayEventPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 진행/결과 이벤트를 RabbitMQ로 내보내는 기술적 구현을 분리해 도메인이 전송 방식을 모르게 하기 위함.
 */
@ApplicationScoped
public class RabbitRelayEventProducer implements RelayEventPort {

    private static final Logger log = Logger.getLogger(RabbitRelayEventProducer.class);

    private final Emitter<String> eventEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitRelayEventProducer(@Channel("relay-events") Emitter<String> eventEmitter, ObjectMapper objectMapper) {
        this.eventEmitter = eventEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(RelayEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(EventPayload.from(event));
        } catch (JsonProcessingException e) {
            log.errorf(e, "이벤트 직렬화 실패 requestId=%s type=%s", event.requestId(), event.type());
            return;
        }
        try {
            eventEmitter.send(payload);
        } catch (RuntimeException e) {
            // 이벤트 전송 실패가 진행 중인 배치를 멈추지 않도록 한다.
            log.errorf(e, "이벤트 전송 실패 requestId=%s type=%s", event.requestId(), event.type());
        }
    }

    record EventPayload(String requestId,
                        String callerId,
                        long targetId,
                        String type,
                        int processed,
                        int total,
                        int successful,
                        int failed,
                        int restricted,
                        String errorKind,
                        String message) {

        static EventPayload from(RelayEvent event) {
            return new EventPayload(event.requestId(), event.callerId(), event.targetId(), event.type().name(),
                    event.processed(), event.total(),
                    event.tally().successful(), event.tally().failed(), event.tally().restrictedCount(),
                    event.errorKind() == null ? null : event.errorKind().name(),
                    event.message());
        }
    }
}
