package com.my.relay.domain.service;

import com.my.relay.domain.port.in.UpdatePacingUseCase;
import com.my.relay.domain.port.out.SettingsPort;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * 왜: 일반 등급 작업 간격 변경을 즉시 반영하고 설정 저장소에 남겨 재시작 후에도 유지하기 위함.
 */
public class PacingPreferenceService implements UpdatePacingUseCase {

    static final String STANDARD_INTERVAL_KEY = "pacing.standard-interval-ms";

    private static final Logger log = Logger.getLogger(PacingPreferenceService.class);

    private final PacingController pacing;
    private final SettingsPort settingsPort;

    public PacingPreferenceService(PacingController pacing, SettingsPort settingsPort) {
        this.pacing = pacing;
        this.settingsPort = settingsPort;
    }

    /**
     * 저장된 간격이 있으면 페이싱 컨트롤러에 적용한다. 읽을 수 없는 값은 무시하고 기본값을 유지한다.
     */
    public void restore() {
        settingsPort.get(STANDARD_INTERVAL_KEY).ifPresent(value -> {
            try {
                long millis = Long.parseLong(value.trim());
                if (millis < 0) {
                    log.warnf("저장된 작업 간격이 음수라 무시합니다: %s", value);
                    return;
                }
                pacing.updateStandardInterval(Duration.ofMillis(millis));
            } catch (NumberFormatException e) {
                log.warnf("저장된 작업 간격을 읽을 수 없어 무시합니다: %s", value);
            }
        });
    }

    @Override
    public Duration updateStandardInterval(Duration interval) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("작업 간격은 0 이상이어야 합니다.");
        }
        pacing.updateStandardInterval(interval);
        settingsPort.put(STANDARD_INTERVAL_KEY, String.valueOf(interval.toMillis()));
        return pacing.standardInterval();
    }
}
