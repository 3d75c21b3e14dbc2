package com.my.timesheet.domain.service.daterange;

import com.my.timesheet.domain.service.text.TextNormalizer;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * 왜: 규칙 평가에 필요한 입력(원문, 정규화 원문, 외부 지정 기간, 기준일, 주 시작 요일)을 한 번만 계산해 공유하기 위함.
 */
public record DateRangeContext(
        String prompt,
        String normalizedPrompt,
        String startDate,
        String endDate,
        LocalDate today,
        DayOfWeek weekStart
) {

    public static DateRangeContext of(String prompt, String startDate, String endDate, LocalDate today, DayOfWeek weekStart) {
        String raw = prompt == null ? "" : prompt;
        return new DateRangeContext(raw, TextNormalizer.normalizePrompt(raw), startDate, endDate, today, weekStart);
    }
}
