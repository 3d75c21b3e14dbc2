package com.my.timesheet.domain.service.daterange;

import java.util.Optional;

/**
 * 요청 필드로 들어온 start/end. 한쪽만 있으면 그 날짜 하루.
 */
public class ExplicitBoundsRule implements DateRangeRule {

    @Override
    public Optional<DateRangeOutcome> apply(DateRangeContext context) {
        String start = blankToNull(context.startDate());
        String end = blankToNull(context.endDate());
        if (start == null && end == null) {
            return Optional.empty();
        }
        String from = start != null ? start : end;
        String to = end != null ? end : start;
        return Optional.of(WorkCalendar.bounded(from, to));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
