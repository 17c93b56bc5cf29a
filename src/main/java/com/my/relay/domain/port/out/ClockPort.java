package com.my.relay.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 TTL과 페이싱 계산을 테스트에서 통제하기 위함.
 */
public interface ClockPort {
    Instant now();
}
