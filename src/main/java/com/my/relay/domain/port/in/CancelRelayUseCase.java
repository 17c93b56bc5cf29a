package com.my.relay.domain.port.in;

public interface CancelRelayUseCase {

    /**
     * @return 취소할 진행 중 배치가 있었으면 true
     */
    boolean cancel(String callerId);
}
