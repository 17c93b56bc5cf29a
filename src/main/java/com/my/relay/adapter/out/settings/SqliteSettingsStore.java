package com.my.relay.adapter.out.settings;

import com.my.relay.domain.port.out.SettingsPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

@IfBuildProperty(name = "relay.store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteSettingsStore implements SettingsPort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS relay_settings (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL
            )
            """;

    private static final String UPSERT_SQL = "INSERT OR REPLACE INTO relay_settings(key, value) VALUES (?, ?)";
    private static final String SELECT_SQL = "SELECT value FROM relay_settings WHERE key = ?";

    private final DataSource dataSource;

    public SqliteSettingsStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("설정 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("설정 조회 실패: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("설정 저장 실패: " + key, e);
        }
    }
}
