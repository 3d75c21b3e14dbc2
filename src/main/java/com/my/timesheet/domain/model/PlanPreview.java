package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 미리보기 결과(확정 계획, 합계, 경고) 또는 실패 사유(오류, 되물을 필드)를 한 번에 돌려주기 위함.
 */
public record PlanPreview(
        List<PlanIssue> errors,
        List<String> missingFields,
        List<PlanIssue> warnings,
        NormalizedPlan plan,
        Totals totals
) {

    public PlanPreview {
        errors = errors == null ? List.of() : List.copyOf(errors);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static PlanPreview failed(List<PlanIssue> errors, List<String> missingFields) {
        return new PlanPreview(errors, missingFields, List.of(), null, null);
    }

    public boolean ok() {
        return errors.isEmpty() && plan != null;
    }
}
