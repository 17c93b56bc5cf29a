package com.my.relay.adapter.out.settings;

import com.my.relay.domain.port.out.SettingsPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "relay.store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemorySettingsStore implements SettingsPort {

    private final Map<String, String> settings = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public void put(String key, String value) {
        settings.put(key, value);
    }
}
