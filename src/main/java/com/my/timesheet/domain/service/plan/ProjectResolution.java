package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.Project;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로젝트 키(소문자 라벨)별 확정 프로젝트와 해석 실패 목록.
 */
public record ProjectResolution(Map<String, Project> projects, List<PlanIssue> errors) {

    public ProjectResolution {
        projects = Map.copyOf(projects);
        errors = List.copyOf(errors);
    }

    public Optional<Project> project(String key) {
        return Optional.ofNullable(projects.get(key));
    }
}
