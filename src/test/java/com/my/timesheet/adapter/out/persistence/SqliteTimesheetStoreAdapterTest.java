package com.my.timesheet.adapter.out.persistence;

import com.my.timesheet.domain.exception.DuplicateCommitException;
import com.my.timesheet.domain.model.DraftTimesheet;
import com.my.timesheet.domain.model.ExistingTimesheet;
import com.my.timesheet.domain.model.TimesheetStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteTimesheetStoreAdapterTest {

    private static final LocalDate DAY = LocalDate.of(2026, 2, 10);

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private SqliteTimesheetStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        dataSource = SqliteFixture.open(tempDir);
        adapter = new SqliteTimesheetStoreAdapter(dataSource);
    }

    @Test
    void createsDraftsWithIncreasingIds() throws Exception {
        List<Long> ids = adapter.createDrafts("42:req-1",
                List.of(draft("09:00", "12:00", "3.00", "site visit"), draft("13:00", "17:00", "4.00", null)));

        assertThat(ids).hasSize(2);
        long first = ids.get(0);
        assertThat(ids.get(1)).isGreaterThan(first);
        assertThat(count("SELECT COUNT(*) FROM plan_commits WHERE commit_key = '42:req-1' AND entry_count = 2")).isEqualTo(1);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT date, status, hours_worked, description, created_by FROM timesheets WHERE id = ?")) {
            ps.setLong(1, first);
            try (ResultSet rs = ps.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getString("date")).isEqualTo("2026-02-10");
                assertThat(rs.getString("status")).isEqualTo("draft");
                assertThat(rs.getDouble("hours_worked")).isEqualTo(3.0);
                assertThat(rs.getString("description")).isEqualTo("site visit");
                assertThat(rs.getLong("created_by")).isEqualTo(42L);
            }
        }
    }

    @Test
    void findsEntriesOfTheDayIncludingLegacyRows() throws Exception {
        adapter.createDrafts("42:req-1", List.of(draft("09:00", "12:00", "3.00", null)));
        SqliteFixture.exec(dataSource,
                "INSERT INTO timesheets(technician_id, project_id, task_id, location_id, date, start_time, end_time, hours_worked, status)"
                        + " VALUES (7, 1, 11, 21, '2026-02-10 00:00:00', NULL, NULL, 2.5, 'approved')",
                "INSERT INTO timesheets(technician_id, project_id, task_id, location_id, date, start_time, end_time, status)"
                        + " VALUES (7, 1, 11, 21, '2026-02-11', '08:00', '09:00', 'draft')",
                "INSERT INTO timesheets(technician_id, project_id, task_id, location_id, date, start_time, end_time, status)"
                        + " VALUES (8, 1, 11, 21, '2026-02-10', '08:00', '09:00', 'draft')");

        List<ExistingTimesheet> entries = adapter.findEntries(7, DAY);

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).startTime()).isEqualTo("09:00");
        assertThat(entries.get(0).hoursWorked()).isEqualTo(3.0);
        assertThat(entries.get(1).startTime()).isNull();
        assertThat(entries.get(1).status()).isEqualTo("approved");
        assertThat(entries.get(1).hoursWorked()).isEqualTo(2.5);
    }

    @Test
    void failedInsertRollsBackTheWholeBatchAndTheCommitKey() throws Exception {
        SqliteFixture.exec(dataSource,
                "CREATE TRIGGER reject_afternoon BEFORE INSERT ON timesheets WHEN NEW.start_time = '13:00'"
                        + " BEGIN SELECT RAISE(ABORT, 'afternoon rejected'); END");

        assertThatThrownBy(() -> adapter.createDrafts("42:req-1",
                List.of(draft("09:00", "12:00", "3.00", null), draft("13:00", "17:00", "4.00", null))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("42:req-1");

        assertThat(count("SELECT COUNT(*) FROM timesheets")).isZero();
        assertThat(count("SELECT COUNT(*) FROM plan_commits")).isZero();

        SqliteFixture.exec(dataSource, "DROP TRIGGER reject_afternoon");
        assertThat(adapter.createDrafts("42:req-1", List.of(draft("09:00", "12:00", "3.00", null)))).hasSize(1);
    }

    @Test
    void sameCommitKeyIsWrittenOnlyOnce() throws Exception {
        adapter.createDrafts("42:req-1", List.of(draft("09:00", "12:00", "3.00", null)));

        assertThatThrownBy(() -> adapter.createDrafts("42:req-1", List.of(draft("13:00", "17:00", "4.00", null))))
                .isInstanceOf(DuplicateCommitException.class);

        assertThat(count("SELECT COUNT(*) FROM timesheets")).isEqualTo(1);
        assertThat(adapter.createDrafts("43:req-1", List.of(draft("13:00", "17:00", "4.00", null)))).hasSize(1);
    }

    private long count(String sql) throws Exception {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static DraftTimesheet draft(String start, String end, String hours, String description) {
        return new DraftTimesheet(7, 1, 11, 21, DAY, start, end, new BigDecimal(hours), description,
                TimesheetStatus.DRAFT, 42, 42);
    }
}
