package com.my.timesheet.adapter.in.idempotency;

import com.my.timesheet.config.TestAppConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteIdempotencyStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("timesheets.db").toAbsolutePath());
        return dataSource;
    }

    @Test
    void storesAndCleansWithTtl() throws Exception {
        SQLiteDataSource dataSource = dataSource();
        SqliteIdempotencyStore store = new SqliteIdempotencyStore(dataSource, new TestAppConfig());
        store.init();

        assertThat(store.isProcessed("42:req-1")).isFalse();

        store.markProcessed("42:req-1");
        assertThat(store.isProcessed("42:req-1")).isTrue();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("UPDATE idempotency_log SET processed_at = ? WHERE request_key = ?")) {
            ps.setLong(1, Instant.now().minusSeconds(4000).toEpochMilli());
            ps.setString(2, "42:req-1");
            ps.executeUpdate();
        }

        assertThat(store.isProcessed("42:req-1")).isFalse();
    }

    @Test
    void expiredRowsAreDeletedOnNextAccess() throws Exception {
        SQLiteDataSource dataSource = dataSource();
        MutableClock clock = new MutableClock(Instant.parse("2026-02-10T09:00:00Z"));
        SqliteIdempotencyStore store = new SqliteIdempotencyStore(dataSource, Duration.ofHours(1), clock);
        store.init();

        store.markProcessed("evt-1");
        clock.advance(Duration.ofHours(2));
        store.markProcessed("evt-2");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT request_key FROM idempotency_log");
             ResultSet rs = ps.executeQuery()) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString(1)).isEqualTo("evt-2");
            assertThat(rs.next()).isFalse();
        }
    }

    @Test
    void survivesReopeningTheSameFile() {
        SqliteIdempotencyStore first = new SqliteIdempotencyStore(dataSource(), new TestAppConfig());
        first.init();
        first.markProcessed("42:req-9");

        SqliteIdempotencyStore second = new SqliteIdempotencyStore(dataSource(), new TestAppConfig());
        second.init();

        assertThat(second.isProcessed("42:req-9")).isTrue();
    }
}
