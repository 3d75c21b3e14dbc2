package com.my.timesheet.domain.model;

/**
 * 왜: 일일 상한, 휴식 규정, 기본 시간대 같은 테넌트 정책 값을 도메인에 설정 프레임워크 없이 전달하기 위함.
 */
public record TimesheetPolicy(
        double dailyHourCap,
        double breakRequiredAfterHours,
        int breakMinMinutes,
        boolean enforceBreaks,
        String defaultTimezone,
        String weekStart
) {

    public static TimesheetPolicy defaults() {
        return new TimesheetPolicy(12, 6, 30, false, "UTC", "monday");
    }

    public int dailyCapMinutes() {
        return (int) Math.round(dailyHourCap * 60);
    }

    public int breakRequiredAfterMinutes() {
        return (int) Math.round(breakRequiredAfterHours * 60);
    }
}
