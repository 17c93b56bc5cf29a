package com.my.relay.domain.port.out;

import com.my.relay.domain.model.RelayOutcome;

import java.time.Instant;
import java.util.List;

/**
 * 왜: 처리 결과를 재시작 이후에도 남는 추가 전용 저장소에 기록하고, 통계가 과거 이력을 읽을 수 있게 하기 위함.
 */
public interface OutcomeLogPort {

    void append(RelayOutcome outcome);

    /**
     * since 이후(포함)에 기록된 결과를 추가된 순서대로 돌려준다.
     */
    List<RelayOutcome> query(Instant since);
}
