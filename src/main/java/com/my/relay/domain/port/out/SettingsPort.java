package com.my.relay.domain.port.out;

import java.util.Optional;

/**
 * 왜: 사용자가 바꾼 페이싱 설정을 재시작 후에도 유지하기 위함.
 */
public interface SettingsPort {

    Optional<String> get(String key);

    void put(String key, String value);
}
