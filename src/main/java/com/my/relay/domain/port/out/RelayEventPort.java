package com.my.relay.domain.port.out;

import com.my.relay.domain.model.RelayEvent;

/**
 * 왜: 진행 상황과 최종 결과를 표현 계층(RabbitMQ 등)으로 내보내는 채널을 도메인에서 분리하기 위함.
 */
public interface RelayEventPort {
    void publish(RelayEvent event);
}
