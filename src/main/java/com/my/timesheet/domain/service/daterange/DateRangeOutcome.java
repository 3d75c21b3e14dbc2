package com.my.timesheet.domain.service.daterange;

import com.my.timesheet.domain.model.PlanIssue;

import java.time.LocalDate;
import java.util.List;

/**
 * 왜: 규칙이 "날짜 목록" 또는 "이 규칙이 맞았지만 값이 잘못됨"을 구분해 돌려주기 위함.
 */
public record DateRangeOutcome(List<LocalDate> dates, PlanIssue issue) {

    public DateRangeOutcome {
        dates = dates == null ? List.of() : List.copyOf(dates);
    }

    public static DateRangeOutcome resolved(List<LocalDate> dates) {
        return new DateRangeOutcome(dates, null);
    }

    public static DateRangeOutcome failed(PlanIssue issue) {
        return new DateRangeOutcome(List.of(), issue);
    }

    public boolean failed() {
        return issue != null;
    }
}
