package com.my.timesheet.domain.service.daterange;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DATE_RANGE=2026-02-10..2026-02-14
 */
public class DateRangeTokenRule implements DateRangeRule {

    private static final Pattern TOKEN = Pattern.compile(
            "DATE_RANGE\\s*=\\s*(\\d{4}-\\d{2}-\\d{2})\\s*\\.\\.\\s*(\\d{4}-\\d{2}-\\d{2})",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<DateRangeOutcome> apply(DateRangeContext context) {
        Matcher matcher = TOKEN.matcher(context.prompt());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(WorkCalendar.bounded(matcher.group(1), matcher.group(2)));
    }
}
