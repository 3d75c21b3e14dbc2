package com.my.timesheet.adapter.out.persistence;

import com.my.timesheet.domain.exception.DuplicateCommitException;
import com.my.timesheet.domain.model.DraftTimesheet;
import com.my.timesheet.domain.model.ExistingTimesheet;
import com.my.timesheet.domain.port.out.TimesheetStorePort;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 기존 타임시트 조회와 초안 기록을 SQLite로 구현하기 위함.
 *
 * <p>초안 묶음과 커밋 키(plan_commits)는 같은 트랜잭션에 기록된다. 중간 실패 시 둘 다 되돌린다.
 */
@ApplicationScoped
public class SqliteTimesheetStoreAdapter implements TimesheetStorePort {

    private static final String ENTRIES_FOR_DAY = """
            SELECT id, start_time, end_time, status, hours_worked
            FROM timesheets
            WHERE technician_id = ? AND substr(date, 1, 10) = ?
            ORDER BY id
            """;
    private static final String INSERT_DRAFT = """
            INSERT INTO timesheets(technician_id, project_id, task_id, location_id, date, start_time, end_time,
                                   hours_worked, description, status, created_by, updated_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String LAST_ID = "SELECT last_insert_rowid()";
    private static final String CLAIM_COMMIT = "INSERT OR IGNORE INTO plan_commits(commit_key, entry_count) VALUES (?, ?)";

    private static final Logger log = Logger.getLogger(SqliteTimesheetStoreAdapter.class);

    private final DataSource dataSource;

    public SqliteTimesheetStoreAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<ExistingTimesheet> findEntries(long technicianId, LocalDate date) {
        List<ExistingTimesheet> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(ENTRIES_FOR_DAY)) {
            ps.setLong(1, technicianId);
            ps.setString(2, date.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    double hours = rs.getDouble("hours_worked");
                    Double hoursWorked = rs.wasNull() ? null : hours;
                    entries.add(new ExistingTimesheet(
                            rs.getLong("id"),
                            rs.getString("start_time"),
                            rs.getString("end_time"),
                            rs.getString("status"),
                            hoursWorked));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("타임시트 조회 실패: technician=" + technicianId + ", date=" + date, e);
        }
        return entries;
    }

    @Override
    public List<Long> createDrafts(String commitKey, List<DraftTimesheet> drafts) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                claimCommitKey(conn, commitKey, drafts.size());
                List<Long> ids = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(INSERT_DRAFT); Statement stmt = conn.createStatement()) {
                    for (DraftTimesheet draft : drafts) {
                        bind(ps, draft);
                        ps.executeUpdate();
                        try (ResultSet rs = stmt.executeQuery(LAST_ID)) {
                            if (!rs.next()) {
                                throw new IllegalStateException("생성된 타임시트 id를 읽지 못했습니다.");
                            }
                            ids.add(rs.getLong(1));
                        }
                    }
                }
                conn.commit();
                log.debugf("타임시트 초안 커밋: key=%s, count=%d", commitKey, ids.size());
                return ids;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("타임시트 초안 기록 실패: key=" + commitKey, e);
        }
    }

    private void claimCommitKey(Connection conn, String commitKey, int count) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(CLAIM_COMMIT)) {
            ps.setString(1, commitKey);
            ps.setInt(2, count);
            if (ps.executeUpdate() == 0) {
                throw new DuplicateCommitException(commitKey);
            }
        }
    }

    private static void bind(PreparedStatement ps, DraftTimesheet draft) throws SQLException {
        ps.setLong(1, draft.technicianId());
        ps.setLong(2, draft.projectId());
        ps.setLong(3, draft.taskId());
        ps.setLong(4, draft.locationId());
        ps.setString(5, draft.date().toString());
        ps.setString(6, draft.startTime());
        ps.setString(7, draft.endTime());
        ps.setBigDecimal(8, draft.hoursWorked());
        if (draft.description() == null) {
            ps.setNull(9, Types.VARCHAR);
        } else {
            ps.setString(9, draft.description());
        }
        ps.setString(10, draft.status().value());
        ps.setLong(11, draft.createdBy());
        ps.setLong(12, draft.updatedBy());
    }
}
