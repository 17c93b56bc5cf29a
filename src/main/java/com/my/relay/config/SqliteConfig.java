package com.my.relay.config;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 처리 이력과 설정을 하나의 SQLite 파일에 두고 재시작 후에도 통계가 과거 이력을 읽도록 하기 위함.
 */
@ApplicationScoped
public class SqliteConfig {

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "relay.store.backend", stringValue = "sqlite", enableIfMissing = true)
    public DataSource relayDataSource(AppConfig appConfig) {
        Path sqlitePath = Path.of(appConfig.store().sqlitePath());
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
        return dataSource;
    }
}
