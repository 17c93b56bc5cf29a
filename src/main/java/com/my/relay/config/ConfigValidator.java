package com.my.relay.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("RELAY_PROVIDER_BASE_URL", appConfig.provider().baseUrl().orElse(null), isProd);
        validatePositive("relay.parser.max-range-size", appConfig.parser().maxRangeSize(), true);
        validatePositive("relay.orchestrator.progress-every", appConfig.orchestrator().progressEvery(), true);
        validatePositive("relay.resolver.scan-limit", appConfig.resolver().scanLimit(), isProd);
        validateNotNegative("relay.pacing.standard-interval", appConfig.pacing().standardInterval());
        validateNotNegative("relay.pacing.privileged-interval", appConfig.pacing().privilegedInterval());
        validateNotNegative("relay.pacing.backoff-cap", appConfig.pacing().backoffCap());
        if (appConfig.pacing().privilegedInterval().compareTo(appConfig.pacing().standardInterval()) > 0) {
            log.warn("우선 등급 간격이 일반 등급 간격보다 깁니다.");
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validatePositive(String name, long value, boolean strict) {
        if (value <= 0) {
            String message = "설정 값은 1 이상이어야 합니다: " + name + "=" + value;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateNotNegative(String name, Duration value) {
        if (value.isNegative()) {
            throw new IllegalStateException("설정 값은 음수일 수 없습니다: " + name + "=" + value);
        }
    }
}
