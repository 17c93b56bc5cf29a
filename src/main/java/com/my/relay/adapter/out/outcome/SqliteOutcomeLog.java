package com.my.relay.adapter.out.outcome;

import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.model.RelayStatus;
import com.my.relay.domain.port.out.OutcomeLogPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 처리 결과를 재시작 후에도 읽을 수 있도록 파일 기반 SQLite에 추가 전용으로 기록하기 위함.
 */
@IfBuildProperty(name = "relay.store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteOutcomeLog implements OutcomeLogPort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS relay_outcomes (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                conversation_id INTEGER NOT NULL,
                message_id INTEGER NOT NULL,
                target_id INTEGER NOT NULL,
                status TEXT NOT NULL,
                reason TEXT NOT NULL,
                processed_at INTEGER NOT NULL
            )
            """;

    private static final String INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_relay_outcomes_processed_at ON relay_outcomes(processed_at)";
    private static final String INSERT_SQL = """
            INSERT INTO relay_outcomes(conversation_id, message_id, target_id, status, reason, processed_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_SQL = """
            SELECT conversation_id, message_id, target_id, status, reason, processed_at
            FROM relay_outcomes WHERE processed_at >= ? ORDER BY id
            """;
    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private final DataSource dataSource;

    public SqliteOutcomeLog(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(TABLE_DDL);
            stmt.execute(INDEX_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("처리 이력 테이블 초기화 실패", e);
        }
    }

    @Override
    public synchronized void append(RelayOutcome outcome) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setLong(1, outcome.conversationId());
            ps.setLong(2, outcome.messageId());
            ps.setLong(3, outcome.targetId());
            ps.setString(4, outcome.status().name());
            ps.setString(5, outcome.reason());
            ps.setLong(6, outcome.timestamp().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("처리 이력 기록 실패", e);
        }
    }

    @Override
    public List<RelayOutcome> query(Instant since) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setLong(1, since.toEpochMilli());
            List<RelayOutcome> outcomes = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    outcomes.add(new RelayOutcome(
                            rs.getLong("conversation_id"),
                            rs.getLong("message_id"),
                            rs.getLong("target_id"),
                            RelayStatus.valueOf(rs.getString("status")),
                            rs.getString("reason"),
                            Instant.ofEpochMilli(rs.getLong("processed_at"))));
                }
            }
            return outcomes;
        } catch (SQLException e) {
            throw new IllegalStateException("처리 이력 조회 실패", e);
        }
    }
}
