package com.my.timesheet.domain.model;

import java.util.Objects;

/**
 * 왜: 계획 대상 기술자와 그 사용자 계정을 한 쌍으로 고정해 단계 간 불일치를 막기 위함.
 */
public record PlanTarget(Technician technician, long userId) {

    public PlanTarget {
        Objects.requireNonNull(technician, "technician");
    }
}
