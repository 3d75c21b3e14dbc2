package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 검증 오류가 없을 때만 확정 계획과 합계를 노출하고, 경고는 항상 함께 전달하기 위함.
 */
public record ValidationResult(List<PlanIssue> errors, List<PlanIssue> warnings, NormalizedPlan normalizedPlan, Totals totals) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!errors.isEmpty()) {
            normalizedPlan = null;
            totals = null;
        }
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}
