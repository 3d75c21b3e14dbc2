package com.my.timesheet.domain.model;

/**
 * 왜: 이미 저장된 타임시트를 원본 형태(시간 문자열은 비어 있거나 형식이 다를 수 있음)로 검증기에 넘기기 위함.
 */
public record ExistingTimesheet(long id, String startTime, String endTime, String status, Double hoursWorked) {

    public boolean locksDate() {
        return TimesheetStatus.locksDate(status);
    }

    public boolean missingTime() {
        return startTime == null || endTime == null || startTime.isBlank() || endTime.isBlank();
    }
}
