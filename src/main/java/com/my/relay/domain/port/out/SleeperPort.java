package com.my.relay.domain.port.out;

import java.time.Duration;

/**
 * 왜: 페이싱과 백오프 대기를 실제 스레드 정지와 분리해 테스트에서 시간을 흘려보낼 수 있게 하기 위함.
 */
public interface SleeperPort {
    void sleep(Duration duration) throws InterruptedException;
}
