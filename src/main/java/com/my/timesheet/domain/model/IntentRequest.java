package com.my.timesheet.domain.model;

/**
 * 왜: 의도 추출에 필요한 원문과 보조 입력(시간대, 주 시작 요일, 외부 지정 기간)을 한 번에 전달하기 위함.
 */
public record IntentRequest(String prompt, String timezone, String weekStart, String startDate, String endDate) {

    public IntentRequest {
        prompt = prompt == null ? "" : prompt;
    }
}
