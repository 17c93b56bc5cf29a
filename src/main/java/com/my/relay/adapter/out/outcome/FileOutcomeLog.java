package com.my.relay.adapter.out.outcome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.port.out.OutcomeLogPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: DB 없이도 처리 이력을 남길 수 있도록 한 줄에 한 건씩 JSON으로 추가 기록하기 위함.
 */
@IfBuildProperty(name = "relay.store.backend", stringValue = "file")
@ApplicationScoped
public class FileOutcomeLog implements OutcomeLogPort {

    private static final Logger log = Logger.getLogger(FileOutcomeLog.class);

    private final Path logPath;
    private final ObjectMapper objectMapper;

    @Inject
    public FileOutcomeLog(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.store().outcomesPath()), objectMapper);
    }

    FileOutcomeLog(Path logPath, ObjectMapper objectMapper) {
        this.logPath = logPath;
        this.objectMapper = objectMapper;
        try {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(logPath)) {
                Files.createFile(logPath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("처리 이력 파일 초기화 실패", e);
        }
    }

    @Override
    public synchronized void append(RelayOutcome outcome) {
        try {
            String entry = objectMapper.writeValueAsString(OutcomeLine.from(outcome)) + System.lineSeparator();
            Files.writeString(logPath, entry, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("처리 이력 기록 실패", e);
        }
    }

    @Override
    public synchronized List<RelayOutcome> query(Instant since) {
        List<RelayOutcome> outcomes = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(logPath, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                RelayOutcome outcome = parse(line);
                if (outcome != null && !outcome.timestamp().isBefore(since)) {
                    outcomes.add(outcome);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("처리 이력 조회 실패", e);
        }
        return outcomes;
    }

    private RelayOutcome parse(String line) {
        try {
            return objectMapper.readValue(line, OutcomeLine.class).toDomain();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warnf("손상된 처리 이력 줄을 건너뜁니다: %s", e.getMessage());
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OutcomeLine(long conversationId,
                       long messageId,
                       long targetId,
                       String status,
                       String reason,
                       long processedAt) {

        static OutcomeLine from(RelayOutcome outcome) {
            return new OutcomeLine(outcome.conversationId(), outcome.messageId(), outcome.targetId(),
                    outcome.status().name(), outcome.reason(), outcome.timestamp().toEpochMilli());
        }

        RelayOutcome toDomain() {
            return new RelayOutcome(conversationId, messageId, targetId, RelayStatus.valueOf(status), reason,
                    Instant.ofEpochMilli(processedAt));
        }
    }
}
