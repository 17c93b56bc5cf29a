package com.my.relay.domain.service;

import com.my.relay.adapter.out.settings.InMemorySettingsStore;
import com.my.relay.support.ManualClock;
import com.my.relay.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PacingPreferenceServiceTest {

    private PacingController pacing;
    private InMemorySettingsStore settings;

    @BeforeEach
    void setUp() {
        ManualClock clock = ManualClock.startingAt("2026-01-01T00:00:00Z");
        pacing = new PacingController(clock, new RecordingSleeper(clock), Duration.ofSeconds(3), Duration.ofSeconds(1),
                Duration.ofMinutes(5));
        settings = new InMemorySettingsStore();
    }

    @Test
    void update_applies_and_persists() {
        PacingPreferenceService service = new PacingPreferenceService(pacing, settings);

        Duration applied = service.updateStandardInterval(Duration.ofMillis(1500));

        assertThat(applied).isEqualTo(Duration.ofMillis(1500));
        assertThat(settings.get(PacingPreferenceService.STANDARD_INTERVAL_KEY)).contains("1500");
    }

    @Test
    void restore_reads_stored_interval() {
        settings.put(PacingPreferenceService.STANDARD_INTERVAL_KEY, "2000");

        new PacingPreferenceService(pacing, settings).restore();

        assertThat(pacing.standardInterval()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void restore_ignores_garbage() {
        settings.put(PacingPreferenceService.STANDARD_INTERVAL_KEY, "fast");

        new PacingPreferenceService(pacing, settings).restore();

        assertThat(pacing.standardInterval()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void negative_interval_is_rejected() {
        PacingPreferenceService service = new PacingPreferenceService(pacing, settings);

        assertThatThrownBy(() -> service.updateStandardInterval(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.get(PacingPreferenceService.STANDARD_INTERVAL_KEY)).isEmpty();
    }
}
