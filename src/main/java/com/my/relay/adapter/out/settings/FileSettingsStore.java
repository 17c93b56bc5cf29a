package com.my.relay.adapter.out.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.port.out.SettingsPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 왜: 파일 백엔드에서도 페이싱 설정을 재시작 후 유지하기 위해 JSON 한 파일에 키-값을 저장한다.
 */
@IfBuildProperty(name = "relay.store.backend", stringValue = "file")
@ApplicationScoped
public class FileSettingsStore implements SettingsPort {

    private static final TypeReference<TreeMap<String, String>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final Path settingsPath;
    private final ObjectMapper objectMapper;

    @Inject
    public FileSettingsStore(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.store().settingsPath()), objectMapper);
    }

    FileSettingsStore(Path settingsPath, ObjectMapper objectMapper) {
        this.settingsPath = settingsPath;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(load().get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        Map<String, String> settings = load();
        settings.put(key, value);
        try {
            Path parent = settingsPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(settingsPath.toFile(), settings);
        } catch (IOException e) {
            throw new IllegalStateException("설정 파일 저장 실패", e);
        }
    }

    private Map<String, String> load() {
        if (!Files.exists(settingsPath)) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(settingsPath.toFile(), SETTINGS_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("설정 파일 읽기 실패", e);
        }
    }
}
