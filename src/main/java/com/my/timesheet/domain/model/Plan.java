package com.my.timesheet.domain.model;

import java.util.List;

/**
 * 왜: 프로젝트/작업/위치가 확정되기 전의 일자별 계획 골격을 불변 값으로 고정하기 위함.
 */
public record Plan(String prompt, String timezone, Long targetUserId, Long technicianId, List<PlanDay> days) {

    public Plan {
        days = days == null ? List.of() : List.copyOf(days);
    }

    public Plan forTarget(PlanTarget target) {
        return new Plan(prompt, timezone, target.userId(), target.technician().id(), days);
    }
}
