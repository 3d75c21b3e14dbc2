package com.my.timesheet.domain.service.daterange;

import com.my.timesheet.domain.model.IntentDateRange;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.service.text.TextNormalizer;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 왜: 기간 표현을 순서가 정해진 규칙 목록으로 평가해 "첫 번째로 맞은 규칙이 이긴다"를 코드 구조로 보장하기 위함.
 *
 * <p>의도(AI 결과)에 기간이 있으면 규칙 대신 그 값을 해석한다.
 */
public class DateRangeResolver {

    private static final Pattern WEEKDAYS_EN = Pattern.compile("\\b(mon|monday)\\s*(?:-|to)\\s*(fri|friday)\\b");
    private static final Pattern WEEKDAYS_PT = Pattern.compile("\\bseg\\s*(?:-|a)\\s*sex(ta)?\\b");

    private final List<DateRangeRule> rules;

    public DateRangeResolver() {
        this(defaultRules());
    }

    public DateRangeResolver(List<DateRangeRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<DateRangeRule> defaultRules() {
        List<DateRangeRule> rules = new ArrayList<>();
        rules.add(new DateRangeTokenRule());
        rules.add(new ExplicitBoundsRule());
        rules.add(new LastWorkdaysRule(LastWorkdaysRule.ENGLISH));
        rules.add(new LastWorkdaysRule(LastWorkdaysRule.PORTUGUESE));
        rules.add(new RelativeWeekRule());
        rules.addAll(LabeledRangeRule.DEFAULTS);
        return rules;
    }

    public DateRangeOutcome resolve(DateRangeContext context) {
        for (DateRangeRule rule : rules) {
            Optional<DateRangeOutcome> outcome = rule.apply(context);
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
        return DateRangeOutcome.failed(PlanIssue.of(IssueCode.DATE_RANGE_NOT_FOUND));
    }

    public DateRangeOutcome resolveIntent(IntentDateRange range, LocalDate today, DayOfWeek weekStart) {
        if (range == null) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.DATE_RANGE_REQUIRED));
        }
        String type = range.normalizedType();
        if (IntentDateRange.ABSOLUTE.equals(type)) {
            return WorkCalendar.bounded(range.from(), range.to());
        }
        if (!IntentDateRange.RELATIVE.equals(type)) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.INVALID_DATE_RANGE));
        }
        switch (range.normalizedValue()) {
            case "this_week":
                return DateRangeOutcome.resolved(WorkCalendar.weekWindow(today, weekStart, 0));
            case "last_week":
                return DateRangeOutcome.resolved(WorkCalendar.weekWindow(today, weekStart, -1));
            case "next_week":
                return DateRangeOutcome.resolved(WorkCalendar.weekWindow(today, weekStart, 1));
            case IntentDateRange.LAST_N_WORKDAYS:
                return WorkCalendar.lastWorkdaysOutcome(today, range.count() == null ? 0 : range.count());
            default:
                return DateRangeOutcome.failed(PlanIssue.of(IssueCode.INVALID_DATE_RANGE));
        }
    }

    /**
     * "mon-fri"/"seg a sex"가 있으면 주말을 뺀다. 결과가 비면 오류.
     */
    public DateRangeOutcome applyWeekdayFilter(List<LocalDate> dates, String prompt) {
        String normalized = TextNormalizer.normalizePrompt(prompt);
        if (!WEEKDAYS_EN.matcher(normalized).find() && !WEEKDAYS_PT.matcher(normalized).find()) {
            return DateRangeOutcome.resolved(dates);
        }
        List<LocalDate> weekdays = dates.stream().filter(WorkCalendar::isWorkday).toList();
        if (weekdays.isEmpty()) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.NO_WEEKDAYS));
        }
        return DateRangeOutcome.resolved(weekdays);
    }
}
