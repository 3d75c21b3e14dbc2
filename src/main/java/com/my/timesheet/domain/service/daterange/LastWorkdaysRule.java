package com.my.timesheet.domain.service.daterange;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "last N workdays" / "ultimos N dias uteis".
 */
public class LastWorkdaysRule implements DateRangeRule {

    public static final Pattern ENGLISH = Pattern.compile("last\\s+(\\d+)\\s+workdays", Pattern.CASE_INSENSITIVE);
    public static final Pattern PORTUGUESE = Pattern.compile("ultimos?\\s+(\\d+)\\s+dias\\s+uteis", Pattern.CASE_INSENSITIVE);

    private final Pattern pattern;

    public LastWorkdaysRule(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public Optional<DateRangeOutcome> apply(DateRangeContext context) {
        // 원문과 악센트 제거본 모두 본다("últimos 3 dias úteis")
        Matcher matcher = pattern.matcher(context.prompt());
        if (!matcher.find()) {
            matcher = pattern.matcher(context.normalizedPrompt());
            if (!matcher.find()) {
                return Optional.empty();
            }
        }
        int count;
        try {
            count = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // 숫자만 매칭하므로 int 범위를 넘는 경우뿐이다
            return Optional.of(DateRangeOutcome.failed(WorkCalendar.tooLong()));
        }
        return Optional.of(WorkCalendar.lastWorkdaysOutcome(context.today(), count));
    }
}
