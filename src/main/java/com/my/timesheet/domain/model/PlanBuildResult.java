package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 계획 골격과 누적된 오류/경고를 함께 돌려 오류가 하나라도 있으면 계획을 쓰지 못하게 하기 위함.
 */
public record PlanBuildResult(Plan plan, List<PlanIssue> errors, List<PlanIssue> warnings) {

    public PlanBuildResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!errors.isEmpty()) {
            plan = null;
        }
    }

    public static PlanBuildResult invalid(List<PlanIssue> errors, List<PlanIssue> warnings) {
        return new PlanBuildResult(null, errors, warnings);
    }

    public boolean ok() {
        return errors.isEmpty() && plan != null;
    }
}
