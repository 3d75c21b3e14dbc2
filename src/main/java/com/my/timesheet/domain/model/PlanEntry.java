package com.my.timesheet.domain.model;

/**
 * 왜: 검증 전 계획의 근무 항목. 미리보기를 거친 계획은 task/location id를 함께 싣고 돌아올 수 있다.
 */
public record PlanEntry(
        Long projectId,
        String projectName,
        Long taskId,
        Long locationId,
        String startTime,
        String endTime,
        String notes
) {

    public static PlanEntry of(long projectId, String projectName, String startTime, String endTime, String notes) {
        return new PlanEntry(projectId, projectName, null, null, startTime, endTime, notes);
    }
}
