package com.my.relay.domain.service;

import com.my.relay.domain.model.CallerProfile;
import com.my.relay.domain.model.CallerTier;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 호출자 프로필을 프로세스 수명 동안 한 번만 만들고, 허용 목록에 있는 호출자를 우선 등급으로 분류하기 위함.
 */
public class CallerRegistry {

    private final Set<String> privilegedCallers;
    private final Map<String, CallerProfile> profiles = new ConcurrentHashMap<>();

    public CallerRegistry(Set<String> privilegedCallers) {
        this.privilegedCallers = Set.copyOf(privilegedCallers);
    }

    public CallerProfile profile(String callerId) {
        return profiles.computeIfAbsent(callerId, id -> new CallerProfile(id, tierOf(id)));
    }

    public CallerTier tierOf(String callerId) {
        return privilegedCallers.contains(callerId) ? CallerTier.PRIVILEGED : CallerTier.STANDARD;
    }
}
