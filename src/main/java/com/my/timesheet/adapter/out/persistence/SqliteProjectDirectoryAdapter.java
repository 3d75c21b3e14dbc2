package com.my.timesheet.adapter.out.persistence;

import com.my.timesheet.domain.model.Location;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.model.Task;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 왜: 프로젝트/작업/위치 조회를 SQLite 테이블에 대한 읽기 전용 질의로 구현하기 위함.
 */
@ApplicationScoped
public class SqliteProjectDirectoryAdapter implements ProjectDirectoryPort {

    private static final String ALL_PROJECTS = "SELECT id, name FROM projects ORDER BY id";
    private static final String PROJECT_BY_ID = "SELECT id, name FROM projects WHERE id = ?";
    private static final String MEMBERSHIP = "SELECT 1 FROM project_members WHERE project_id = ? AND user_id = ?";
    private static final String TASK_IN_PROJECT = "SELECT id, project_id, name, is_active FROM tasks WHERE id = ? AND project_id = ?";
    private static final String DEFAULT_TASK =
            "SELECT id, project_id, name, is_active FROM tasks WHERE project_id = ? ORDER BY is_active DESC, id LIMIT 1";
    private static final String LOCATION_BY_ID = "SELECT id, name, is_active FROM locations WHERE id = ?";
    private static final String FIRST_TASK_LOCATION = """
            SELECT l.id, l.name, l.is_active
            FROM task_locations tl
            JOIN locations l ON l.id = tl.location_id
            WHERE tl.task_id = ?
            ORDER BY l.id
            LIMIT 1
            """;
    private static final String FALLBACK_LOCATION = "SELECT id, name, is_active FROM locations ORDER BY is_active DESC, id LIMIT 1";

    private final DataSource dataSource;

    public SqliteProjectDirectoryAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * SQLite LOWER()는 ASCII만 접으므로 대소문자 비교는 Java에서 한다.
     */
    @Override
    public List<Project> findProjectsByName(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        return findAllProjects().stream()
                .filter(project -> project.name() != null && project.name().trim().toLowerCase(Locale.ROOT).equals(key))
                .toList();
    }

    @Override
    public List<Project> findAllProjects() {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(ALL_PROJECTS)) {
            return projects(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("프로젝트 목록 조회 실패", e);
        }
    }

    @Override
    public Optional<Project> findProject(long projectId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(PROJECT_BY_ID)) {
            ps.setLong(1, projectId);
            return projects(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new IllegalStateException("프로젝트 조회 실패: id=" + projectId, e);
        }
    }

    @Override
    public boolean isProjectMember(long projectId, long userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(MEMBERSHIP)) {
            ps.setLong(1, projectId);
            ps.setLong(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("프로젝트 멤버 조회 실패", e);
        }
    }

    @Override
    public Optional<Task> findTask(long taskId, long projectId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(TASK_IN_PROJECT)) {
            ps.setLong(1, taskId);
            ps.setLong(2, projectId);
            return firstTask(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("작업 조회 실패: id=" + taskId, e);
        }
    }

    @Override
    public Optional<Task> findDefaultTask(long projectId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DEFAULT_TASK)) {
            ps.setLong(1, projectId);
            return firstTask(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("기본 작업 조회 실패: project=" + projectId, e);
        }
    }

    @Override
    public Optional<Location> findLocation(long locationId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(LOCATION_BY_ID)) {
            ps.setLong(1, locationId);
            return firstLocation(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("위치 조회 실패: id=" + locationId, e);
        }
    }

    @Override
    public Optional<Location> findFirstTaskLocation(long taskId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(FIRST_TASK_LOCATION)) {
            ps.setLong(1, taskId);
            return firstLocation(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("작업 위치 조회 실패: task=" + taskId, e);
        }
    }

    @Override
    public Optional<Location> findFallbackLocation() {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(FALLBACK_LOCATION)) {
            return firstLocation(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("대체 위치 조회 실패", e);
        }
    }

    private static List<Project> projects(PreparedStatement ps) throws SQLException {
        List<Project> projects = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                projects.add(new Project(rs.getLong("id"), rs.getString("name")));
            }
        }
        return projects;
    }

    private static Optional<Task> firstTask(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new Task(rs.getLong("id"), rs.getLong("project_id"), rs.getString("name"), rs.getInt("is_active") != 0));
        }
    }

    private static Optional<Location> firstLocation(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new Location(rs.getLong("id"), rs.getString("name"), rs.getInt("is_active") != 0));
        }
    }
}
