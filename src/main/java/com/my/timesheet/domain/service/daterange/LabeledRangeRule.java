package com.my.timesheet.domain.service.daterange;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 두 ISO 날짜를 잇는 표현 하나("from X to Y", "entre X e Y" 등).
 */
public class LabeledRangeRule implements DateRangeRule {

    private static final String DATE = "(\\d{4}-\\d{2}-\\d{2})[.,]?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL;

    /**
     * 평가 순서가 곧 우선순위다.
     */
    public static final List<LabeledRangeRule> DEFAULTS = List.of(
            new LabeledRangeRule("from-to", Pattern.compile("\\bfrom\\s+" + DATE + "\\s+to\\s+" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("de-a", Pattern.compile("\\bde\\s+" + DATE + "\\s+a\\s+" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("de-ate", Pattern.compile("\\bde\\s+" + DATE + "\\s+at(?:e|é)\\s+" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("to", Pattern.compile("\\b" + DATE + "\\s+to\\s+" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("dash", Pattern.compile("\\b" + DATE + "\\s*-\\s*" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("between-and", Pattern.compile("\\bbetween\\s+" + DATE + "\\s+and\\s+" + DATE + "\\b", FLAGS)),
            new LabeledRangeRule("entre-e", Pattern.compile("\\bentre\\s+" + DATE + "\\s+e\\s+" + DATE + "\\b", FLAGS))
    );

    private final String name;
    private final Pattern pattern;

    public LabeledRangeRule(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    public String name() {
        return name;
    }

    @Override
    public Optional<DateRangeOutcome> apply(DateRangeContext context) {
        Matcher matcher = pattern.matcher(context.prompt());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(WorkCalendar.bounded(matcher.group(1), matcher.group(2)));
    }
}
