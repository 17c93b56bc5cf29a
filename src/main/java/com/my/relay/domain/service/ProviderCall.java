package com.my.relay.domain.service;

import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayErrorKind;
import org.jboss.logging.Logger;

/**
 * 프로바이더 호출 래퍼. 포트 구현이 규약을 어기고 던진 런타임 예외를 FATAL 결과로 바꿔 배치가 중단되지 않게 한다.
 */
@FunctionalInterface
interface ProviderCall<T> {

    ProviderResult<T> call();

    static <T> ProviderResult<T> guarded(ProviderCall<T> call) {
        try {
            ProviderResult<T> result = call.call();
            if (result == null) {
                return ProviderResult.failure(RelayErrorKind.FATAL, "프로바이더가 결과를 돌려주지 않았습니다.");
            }
            return result;
        } catch (RuntimeException e) {
            Logger.getLogger(ProviderCall.class).warnf(e, "프로바이더 호출 중 예외: %s", e.getMessage());
            return ProviderResult.failure(RelayErrorKind.FATAL, "예상하지 못한 프로바이더 오류: " + e.getMessage());
        }
    }
}
