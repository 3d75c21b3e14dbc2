package com.my.timesheet.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 왜: 미리보기 화면이 일자별/전체 근무 시간을 별도 계산 없이 보여줄 수 있게 하기 위함.
 */
public record Totals(int overallMinutes, double overallHours, Map<LocalDate, DayTotal> perDay) {

    public Totals {
        perDay = perDay == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perDay));
    }
}
