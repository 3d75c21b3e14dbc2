package com.my.timesheet.domain.model;

import java.time.LocalDate;

/**
 * 왜: 실제 존재하고 권한이 확인된 프로젝트/작업/위치와 계산된 근무 시간(분)을 가진 확정 항목.
 */
public record NormalizedEntry(
        long projectId,
        String projectName,
        long taskId,
        String taskName,
        long locationId,
        String locationName,
        LocalDate date,
        String startTime,
        String endTime,
        int minutes,
        String notes
) {
}
