package com.my.timesheet.domain.model;

/**
 * 왜: 계획 생성 입력. intent가 없으면 프롬프트만으로 해석하는 기존 경로를 탄다.
 */
public record PlanRequest(
        String prompt,
        String timezone,
        String weekStart,
        String startDate,
        String endDate,
        Intent intent
) {

    public PlanRequest {
        prompt = prompt == null ? "" : prompt.trim();
    }

    public PlanRequest withPrompt(String value) {
        return new PlanRequest(value, timezone, weekStart, startDate, endDate, intent);
    }
}
