package com.my.relay.domain.port.in;

import java.time.Duration;

/**
 * 왜: 일반 등급 호출자의 작업 간격을 런타임에 바꾸고 영속화하기 위함.
 */
public interface UpdatePacingUseCase {
    Duration updateStandardInterval(Duration interval);
}
