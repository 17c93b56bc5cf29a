package com.my.relay.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "relay")
public interface AppConfig {

    ParserConfig parser();

    ResolverConfig resolver();

    PacingConfig pacing();

    EngineConfig engine();

    OrchestratorConfig orchestrator();

    StorageConfig storage();

    StoreConfig store();

    ProviderConfig provider();

    interface ParserConfig {
        @WithName("max-range-size")
        @WithDefault("50")
        int maxRangeSize();
    }

    interface ResolverConfig {
        @WithName("cache-ttl")
        @WithDefault("PT1H")
        Duration cacheTtl();

        @WithName("scan-limit")
        @WithDefault("200")
        int scanLimit();
    }

    interface PacingConfig {
        @WithName("standard-interval")
        @WithDefault("PT3S")
        Duration standardInterval();

        @WithName("privileged-interval")
        @WithDefault("PT1S")
        Duration privilegedInterval();

        @WithName("backoff-cap")
        @WithDefault("PT5M")
        Duration backoffCap();

        @WithName("default-backoff")
        @WithDefault("PT5S")
        Duration defaultBackoff();

        @WithName("privileged-callers")
        Optional<List<String>> privilegedCallers();
    }

    interface EngineConfig {
        @WithName("max-media-bytes")
        @WithDefault("52428800")
        long maxMediaBytes();
    }

    interface OrchestratorConfig {
        @WithName("progress-every")
        @WithDefault("10")
        int progressEvery();

        @WithName("statistics-window")
        @WithDefault("PT24H")
        Duration statisticsWindow();
    }

    interface StorageConfig {
        @WithName("download-path")
        @WithDefault("./data/downloads")
        String downloadPath();

        @WithName("archive-path")
        @WithDefault("./data/archive")
        String archivePath();
    }

    interface StoreConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/relay.db")
        String sqlitePath();

        @WithName("outcomes-path")
        @WithDefault("./data/outcomes.jsonl")
        String outcomesPath();

        @WithName("settings-path")
        @WithDefault("./data/settings.json")
        String settingsPath();
    }

    interface ProviderConfig {
        @WithName("base-url")
        Optional<String> baseUrl();

        @WithName("api-token")
        Optional<String> apiToken();

        @WithName("connect-timeout-seconds")
        @WithDefault("5")
        int connectTimeoutSeconds();

        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();

        @WithName("transfer-timeout-seconds")
        @WithDefault("300")
        int transferTimeoutSeconds();
    }
}
