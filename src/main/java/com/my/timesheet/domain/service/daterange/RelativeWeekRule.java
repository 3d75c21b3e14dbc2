package com.my.timesheet.domain.service.daterange;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * "esta semana", "semana passada"/"ultima semana", "proxima semana". 정규화된 원문에서 찾는다.
 */
public class RelativeWeekRule implements DateRangeRule {

    private static final Pattern NEXT = Pattern.compile("\\bproxima\\s+semana\\b");
    private static final Pattern THIS = Pattern.compile("\\besta\\s+semana\\b");
    private static final Pattern LAST = Pattern.compile("\\bsemana\\s+passada\\b");
    private static final Pattern LAST_ALT = Pattern.compile("\\bultima\\s+semana\\b");

    @Override
    public Optional<DateRangeOutcome> apply(DateRangeContext context) {
        String normalized = context.normalizedPrompt();
        Integer offset = null;
        if (NEXT.matcher(normalized).find()) {
            offset = 1;
        } else if (THIS.matcher(normalized).find()) {
            offset = 0;
        } else if (LAST.matcher(normalized).find() || LAST_ALT.matcher(normalized).find()) {
            offset = -1;
        }
        if (offset == null) {
            return Optional.empty();
        }
        return Optional.of(DateRangeOutcome.resolved(
                WorkCalendar.weekWindow(context.today(), context.weekStart(), offset)));
    }
}
