package com.my.timesheet.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 왜: 저장소에 기록할 초안 타임시트의 계약을 고정하기 위함.
 */
public record DraftTimesheet(
        long technicianId,
        long projectId,
        long taskId,
        long locationId,
        LocalDate date,
        String startTime,
        String endTime,
        BigDecimal hoursWorked,
        String description,
        TimesheetStatus status,
        long createdBy,
        long updatedBy
) {
}
