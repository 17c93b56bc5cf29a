package com.my.relay.config;

import com.my.relay.adapter.out.clock.SystemClockAdapter;
import com.my.relay.adapter.out.sleep.ThreadSleeperAdapter;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.LocalStoragePort;
import com.my.relay.domain.port.out.OutcomeLogPort;
import com.my.relay.domain.port.out.ProviderPort;
import com.my.relay.domain.port.out.RelayEventPort;
import com.my.relay.domain.port.out.SettingsPort;
import com.my.relay.domain.port.out.SleeperPort;
import com.my.relay.domain.service.BatchOrchestrator;
import com.my.relay.domain.service.CallerRegistry;
import com.my.relay.domain.service.ConversationResolver;
import com.my.relay.domain.service.PacingController;
import com.my.relay.domain.service.PacingPreferenceService;
import com.my.relay.domain.service.ReferenceParser;
import com.my.relay.domain.service.RelayService;
import com.my.relay.domain.service.RelayStatisticsService;
import com.my.relay.domain.service.RelayStrategyEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.util.List;
import java.util.Set;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하고, 캐시와 백오프 상태를 엔진 인스턴스 하나가 소유하도록 하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ReferenceParser referenceParser(AppConfig appConfig) {
        return new ReferenceParser(appConfig.parser().maxRangeSize());
    }

    @Produces
    @ApplicationScoped
    public ConversationResolver conversationResolver(ProviderPort providerPort, ClockPort clockPort, AppConfig appConfig) {
        return new ConversationResolver(providerPort, clockPort,
                appConfig.resolver().cacheTtl(), appConfig.resolver().scanLimit());
    }

    @Produces
    @ApplicationScoped
    public PacingController pacingController(ClockPort clockPort, SleeperPort sleeperPort, AppConfig appConfig) {
        AppConfig.PacingConfig pacing = appConfig.pacing();
        return new PacingController(clockPort, sleeperPort,
                pacing.standardInterval(), pacing.privilegedInterval(), pacing.backoffCap());
    }

    @Produces
    @ApplicationScoped
    public CallerRegistry callerRegistry(AppConfig appConfig) {
        List<String> privileged = appConfig.pacing().privilegedCallers().orElse(List.of());
        return new CallerRegistry(Set.copyOf(privileged));
    }

    @Produces
    @ApplicationScoped
    public RelayStrategyEngine relayStrategyEngine(ProviderPort providerPort,
                                                   LocalStoragePort localStoragePort,
                                                   ClockPort clockPort,
                                                   AppConfig appConfig) {
        return new RelayStrategyEngine(providerPort, localStoragePort, clockPort, appConfig.engine().maxMediaBytes());
    }

    @Produces
    @ApplicationScoped
    public BatchOrchestrator batchOrchestrator(ConversationResolver resolver,
                                               PacingController pacingController,
                                               RelayStrategyEngine engine,
                                               OutcomeLogPort outcomeLogPort,
                                               ClockPort clockPort,
                                               AppConfig appConfig) {
        return new BatchOrchestrator(resolver, pacingController, engine, outcomeLogPort, clockPort,
                appConfig.pacing().defaultBackoff(), appConfig.orchestrator().progressEvery());
    }

    @Produces
    @ApplicationScoped
    public RelayService relayService(ReferenceParser parser,
                                     BatchOrchestrator orchestrator,
                                     ConversationResolver resolver,
                                     CallerRegistry callerRegistry,
                                     RelayEventPort relayEventPort) {
        return new RelayService(parser, orchestrator, resolver, callerRegistry, relayEventPort);
    }

    @Produces
    @ApplicationScoped
    public RelayStatisticsService relayStatisticsService(OutcomeLogPort outcomeLogPort,
                                                         ClockPort clockPort,
                                                         LocalStoragePort localStoragePort) {
        return new RelayStatisticsService(outcomeLogPort, clockPort, localStoragePort);
    }

    @Produces
    @ApplicationScoped
    public PacingPreferenceService pacingPreferenceService(PacingController pacingController, SettingsPort settingsPort) {
        PacingPreferenceService service = new PacingPreferenceService(pacingController, settingsPort);
        service.restore();
        return service;
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    @Produces
    @ApplicationScoped
    public SleeperPort sleeperPort() {
        return new ThreadSleeperAdapter();
    }
}
