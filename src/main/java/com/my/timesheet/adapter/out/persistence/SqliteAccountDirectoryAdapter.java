package com.my.timesheet.adapter.out.persistence;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.Technician;
import com.my.timesheet.domain.port.out.AccountDirectoryPort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class SqliteAccountDirectoryAdapter implements AccountDirectoryPort {

    private static final String USER_BY_ID = "SELECT id, email FROM users WHERE id = ?";
    private static final String ROLES = "SELECT role FROM user_roles WHERE user_id = ? ORDER BY role";
    private static final String PERMISSIONS = "SELECT permission FROM user_permissions WHERE user_id = ? ORDER BY permission";
    private static final String TECHNICIAN_BY_ID = "SELECT id, user_id, email FROM technicians WHERE id = ?";
    private static final String TECHNICIAN_BY_USER = "SELECT id, user_id, email FROM technicians WHERE user_id = ? ORDER BY id LIMIT 1";
    private static final String TECHNICIAN_BY_EMAIL = "SELECT id, user_id, email FROM technicians WHERE LOWER(email) = ? ORDER BY id LIMIT 1";

    private final DataSource dataSource;

    public SqliteAccountDirectoryAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Actor> findActor(long userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(USER_BY_ID)) {
            ps.setLong(1, userId);
            String email;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                email = rs.getString("email");
            }
            return Optional.of(new Actor(userId, email, values(conn, ROLES, userId), values(conn, PERMISSIONS, userId)));
        } catch (SQLException e) {
            throw new IllegalStateException("사용자 조회 실패: id=" + userId, e);
        }
    }

    @Override
    public Optional<Technician> findTechnician(long technicianId) {
        return technician(TECHNICIAN_BY_ID, ps -> ps.setLong(1, technicianId));
    }

    @Override
    public Optional<Technician> findTechnicianByUserId(long userId) {
        return technician(TECHNICIAN_BY_USER, ps -> ps.setLong(1, userId));
    }

    @Override
    public Optional<Technician> findTechnicianByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return technician(TECHNICIAN_BY_EMAIL, ps -> ps.setString(1, email.trim().toLowerCase(Locale.ROOT)));
    }

    private Optional<Technician> technician(String sql, Binder binder) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long userId = rs.getLong("user_id");
                Long linkedUser = rs.wasNull() ? null : userId;
                return Optional.of(new Technician(rs.getLong("id"), linkedUser, rs.getString("email")));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("기술자 조회 실패", e);
        }
    }

    private static Set<String> values(Connection conn, String sql, long userId) throws SQLException {
        Set<String> values = new LinkedHashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
        }
        return values;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
