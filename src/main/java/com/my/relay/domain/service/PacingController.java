package com.my.relay.domain.service;

import com.my.relay.domain.model.CallerProfile;
import com.my.relay.domain.model.CallerTier;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.SleeperPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 호출자 등급별 최소 작업 간격과 프로바이더 연결 전체에 걸리는 백오프를 한 곳에서 강제하기 위함.
 *
 * <p>전역 백오프 마감 시각은 유일하게 경합되는 상태이므로 락 안에서만 읽고 쓴다.
 * 같은 백오프를 두 작업자가 동시에 보고해도 마감 시각은 더 늦은 쪽 하나로 합쳐진다.
 * 대기 자체는 락 밖에서 수행한다.
 */
public class PacingController {

    private static final Logger log = Logger.getLogger(PacingController.class);

    private final ClockPort clockPort;
    private final SleeperPort sleeperPort;
    private final Duration privilegedInterval;
    private final Duration backoffCap;
    private final Object lock = new Object();
    private volatile Duration standardInterval;
    private Instant backoffUntil = Instant.EPOCH;

    public PacingController(ClockPort clockPort,
                            SleeperPort sleeperPort,
                            Duration standardInterval,
                            Duration privilegedInterval,
                            Duration backoffCap) {
        this.clockPort = clockPort;
        this.sleeperPort = sleeperPort;
        this.standardInterval = requireNonNegative(standardInterval, "standardInterval");
        this.privilegedInterval = requireNonNegative(privilegedInterval, "privilegedInterval");
        this.backoffCap = requireNonNegative(backoffCap, "backoffCap");
    }

    /**
     * 호출자의 직전 작업 이후 등급 간격이 지나고 전역 백오프가 끝날 때까지 대기한 뒤 작업 시각을 기록한다.
     * 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 기록 없이 돌아온다.
     */
    public void waitTurn(CallerProfile caller) {
        while (true) {
            Duration wait;
            synchronized (lock) {
                Instant now = clockPort.now();
                wait = longer(remaining(now, backoffUntil), callerWait(caller, now));
                if (wait.isZero()) {
                    caller.markOperation(now);
                    return;
                }
            }
            if (!sleep(wait)) {
                return;
            }
        }
    }

    /**
     * 프로바이더의 대기 지시를 상한으로 자른 만큼 전역 일시 정지로 반영하고 그 시간이 끝날 때까지 대기한다.
     * 예외를 던지지 않는다.
     */
    public void onProviderBackoff(Duration advised) {
        Duration capped = cap(advised);
        Instant deadline;
        synchronized (lock) {
            Instant proposed = clockPort.now().plus(capped);
            if (proposed.isAfter(backoffUntil)) {
                backoffUntil = proposed;
            }
            deadline = backoffUntil;
        }
        log.warnf("프로바이더 백오프 적용: 요청=%s 적용=%s", advised, capped);
        while (true) {
            Duration wait = remaining(clockPort.now(), deadline);
            if (wait.isZero() || !sleep(wait)) {
                return;
            }
        }
    }

    public Duration cap(Duration advised) {
        if (advised == null || advised.isNegative()) {
            return Duration.ZERO;
        }
        return advised.compareTo(backoffCap) > 0 ? backoffCap : advised;
    }

    public Duration intervalFor(CallerTier tier) {
        return tier == CallerTier.PRIVILEGED ? privilegedInterval : standardInterval;
    }

    public Duration standardInterval() {
        return standardInterval;
    }

    public void updateStandardInterval(Duration interval) {
        this.standardInterval = requireNonNegative(interval, "standardInterval");
        log.infof("일반 등급 작업 간격 변경: %s", interval);
    }

    public Instant backoffUntil() {
        synchronized (lock) {
            return backoffUntil;
        }
    }

    private Duration callerWait(CallerProfile caller, Instant now) {
        Instant last = caller.lastOperationAt();
        if (last == null) {
            return Duration.ZERO;
        }
        return remaining(now, last.plus(intervalFor(caller.tier())));
    }

    private boolean sleep(Duration duration) {
        try {
            sleeperPort.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration remaining(Instant now, Instant until) {
        Duration left = Duration.between(now, until);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Duration longer(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + "는 음수일 수 없습니다.");
        }
        return value;
    }
}
