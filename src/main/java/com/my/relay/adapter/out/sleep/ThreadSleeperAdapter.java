package com.my.relay.adapter.out.sleep;

import com.my.relay.domain.port.out.SleeperPort;

import java.time.Duration;

public class ThreadSleeperAdapter implements SleeperPort {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
