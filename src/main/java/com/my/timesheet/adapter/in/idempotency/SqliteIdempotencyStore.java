package com.my.timesheet.adapter.in.idempotency;

import com.my.timesheet.config.AppConfig;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 왜: 재시작 후에도 같은 커밋이 두 번 반영되지 않도록 처리 기록을 타임시트와 같은 SQLite 파일에 남긴다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteIdempotencyStore implements IdempotencyStore {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS idempotency_log (
                request_key TEXT PRIMARY KEY,
                processed_at INTEGER NOT NULL
            )
            """;

    private static final String INSERT_SQL = "INSERT OR REPLACE INTO idempotency_log(request_key, processed_at) VALUES (?, ?)";
    private static final String SELECT_SQL = "SELECT 1 FROM idempotency_log WHERE request_key = ? AND processed_at >= ?";
    private static final String CLEANUP_SQL = "DELETE FROM idempotency_log WHERE processed_at < ?";

    private final DataSource dataSource;
    private final Duration ttl;
    private final Clock clock;

    public SqliteIdempotencyStore(DataSource dataSource, AppConfig appConfig) {
        this(dataSource, Duration.ofHours(appConfig.idempotency().ttlHours()), Clock.systemUTC());
    }

    SqliteIdempotencyStore(DataSource dataSource, Duration ttl, Clock clock) {
        this.dataSource = dataSource;
        this.ttl = ttl;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("Idempotency 테이블 초기화 실패", e);
        }
    }

    @Override
    public boolean isProcessed(String key) {
        cleanup();
        Instant cutoff = clock.instant().minus(ttl);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, key);
            ps.setLong(2, cutoff.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Idempotency 조회 실패", e);
        }
    }

    @Override
    public void markProcessed(String key) {
        cleanup();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, key);
            ps.setLong(2, clock.instant().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Idempotency 기록 실패", e);
        }
    }

    private void cleanup() {
        Instant cutoff = clock.instant().minus(ttl);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(CLEANUP_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Idempotency 정리 실패", e);
        }
    }
}
