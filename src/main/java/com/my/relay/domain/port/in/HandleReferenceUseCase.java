package com.my.relay.domain.port.in;

import com.my.relay.domain.model.BatchResult;
import com.my.relay.domain.model.RelayRequest;

/**
 * 왜: 호스트 계층의 원시 참조 요청을 도메인 단일 진입점으로 수렴시키고, 진행 이벤트는 이벤트 포트로 흘려보내기 위함.
 */
public interface HandleReferenceUseCase {
    BatchResult handle(RelayRequest request);
}
