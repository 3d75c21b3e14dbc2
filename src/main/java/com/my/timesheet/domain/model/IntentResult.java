package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 의도 추출의 하드 실패(errors)와 추가 질문이 필요한 상태(missingFields)를 구분해 돌려주기 위함.
 */
public record IntentResult(Intent intent, List<PlanIssue> errors, List<String> missingFields) {

    public IntentResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static IntentResult failed(PlanIssue error) {
        return new IntentResult(null, List.of(error), List.of());
    }

    public boolean ok() {
        return errors.isEmpty() && missingFields.isEmpty();
    }
}
