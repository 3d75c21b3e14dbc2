package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 검증을 통과한 계획을 골격과 분리된 새 값으로 만들어 저장 단계가 그대로 신뢰할 수 있게 하기 위함.
 */
public record NormalizedPlan(String prompt, String timezone, long targetUserId, long technicianId, List<NormalizedDay> days) {

    public NormalizedPlan {
        days = days == null ? List.of() : List.copyOf(days);
    }
}
