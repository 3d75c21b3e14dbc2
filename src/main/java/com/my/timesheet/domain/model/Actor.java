package com.my.timesheet.domain.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 요청을 보낸 사용자의 역할과 권한을 도메인에서 바로 판단할 수 있게 하기 위함.
 */
public record Actor(long id, String email, Set<String> roles, Set<String> permissions) {

    public static final String CREATE_TIMESHEETS = "create-timesheets";

    public Actor {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean can(String permission) {
        return permissions.contains(permission);
    }

    public boolean hasRole(String role) {
        return roles.stream().anyMatch(r -> Objects.equals(r.toLowerCase(Locale.ROOT), role.toLowerCase(Locale.ROOT)));
    }
}
