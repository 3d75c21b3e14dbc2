package com.my.timesheet.adapter.out.persistence;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * 왜: 워커가 빈 SQLite 파일에서도 바로 동작하도록 시작 시 테이블을 보장하기 위함.
 *
 * <p>timesheets.start_time/end_time은 자유 텍스트다. 예전 데이터는 비어 있거나 다른 형식일 수 있다.
 */
@Startup
@ApplicationScoped
public class SqliteSchemaInitializer {

    private static final Logger log = Logger.getLogger(SqliteSchemaInitializer.class);

    static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id INTEGER PRIMARY KEY,
                name TEXT,
                email TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS user_roles (
                user_id INTEGER NOT NULL,
                role TEXT NOT NULL,
                PRIMARY KEY (user_id, role)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS user_permissions (
                user_id INTEGER NOT NULL,
                permission TEXT NOT NULL,
                PRIMARY KEY (user_id, permission)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS technicians (
                id INTEGER PRIMARY KEY,
                user_id INTEGER,
                email TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS projects (
                id INTEGER PRIMARY KEY,
                name TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS project_members (
                project_id INTEGER NOT NULL,
                user_id INTEGER NOT NULL,
                PRIMARY KEY (project_id, user_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tasks (
                id INTEGER PRIMARY KEY,
                project_id INTEGER NOT NULL,
                name TEXT NOT NULL,
                is_active INTEGER NOT NULL DEFAULT 1
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS locations (
                id INTEGER PRIMARY KEY,
                name TEXT NOT NULL,
                is_active INTEGER NOT NULL DEFAULT 1
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS task_locations (
                task_id INTEGER NOT NULL,
                location_id INTEGER NOT NULL,
                PRIMARY KEY (task_id, location_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS timesheets (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                technician_id INTEGER NOT NULL,
                project_id INTEGER NOT NULL,
                task_id INTEGER NOT NULL,
                location_id INTEGER NOT NULL,
                date TEXT NOT NULL,
                start_time TEXT,
                end_time TEXT,
                hours_worked REAL,
                description TEXT,
                status TEXT NOT NULL DEFAULT 'draft',
                created_by INTEGER,
                updated_by INTEGER
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS plan_commits (
                commit_key TEXT PRIMARY KEY,
                entry_count INTEGER NOT NULL,
                committed_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_timesheets_technician_date ON timesheets(technician_id, date)"
    );

    private final DataSource dataSource;

    public SqliteSchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("타임시트 스키마 초기화 실패", e);
        }
        log.infof("타임시트 스키마 준비 완료: tables=%d", DDL.size() - 1);
    }
}
