package com.my.timesheet.domain.service.daterange;

import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanIssue;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 왜: 기간 전개, 영업일 역산, 주 단위 창 계산을 순수 함수로 모아 규칙들이 재사용하도록 하기 위함.
 *
 * <p>영업일은 월~금이며 공휴일은 고려하지 않는다.
 */
public final class WorkCalendar {

    /** 한 계획이 다룰 수 있는 최대 일수. 기간과 "last N workdays" 모두에 적용된다. */
    public static final int MAX_PLAN_DAYS = 62;

    private WorkCalendar() {
    }

    /**
     * 양 끝을 포함한 연속 날짜 목록.
     */
    public static List<LocalDate> expand(LocalDate from, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate cursor = from; !cursor.isAfter(to); cursor = cursor.plusDays(1)) {
            dates.add(cursor);
        }
        return dates;
    }

    /**
     * 오늘부터 거꾸로 주말을 건너뛰며 count개의 영업일을 모은다. 오래된 날짜부터 반환.
     */
    public static List<LocalDate> lastWorkdays(LocalDate today, int count) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate cursor = today;
        while (dates.size() < count) {
            if (isWorkday(cursor)) {
                dates.add(cursor);
            }
            cursor = cursor.minusDays(1);
        }
        Collections.reverse(dates);
        return dates;
    }

    /**
     * 주 시작 요일 기준 이번 주 창을 weekOffset만큼 이동한 7일.
     */
    public static List<LocalDate> weekWindow(LocalDate today, DayOfWeek weekStart, int weekOffset) {
        LocalDate start = today.with(TemporalAdjusters.previousOrSame(weekStart)).plusWeeks(weekOffset);
        return expand(start, start.plusDays(6));
    }

    public static boolean isWorkday(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public static DayOfWeek resolveWeekStart(String weekStart) {
        String key = weekStart == null ? "" : weekStart.trim().toUpperCase(Locale.ROOT);
        if (key.isEmpty()) {
            return DayOfWeek.MONDAY;
        }
        try {
            return DayOfWeek.valueOf(key);
        } catch (IllegalArgumentException e) {
            return DayOfWeek.MONDAY;
        }
    }

    /**
     * ISO 날짜(yyyy-MM-dd). 뒤에 시간이 붙어 있으면 날짜 부분만 사용한다.
     */
    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.length() > 10 && (trimmed.charAt(10) == 'T' || trimmed.charAt(10) == ' ')) {
            trimmed = trimmed.substring(0, 10);
        }
        try {
            return Optional.of(LocalDate.parse(trimmed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * 두 경계 문자열을 해석해 포함 범위로 전개한다.
     */
    public static DateRangeOutcome bounded(String from, String to) {
        Optional<LocalDate> start = parseDate(from);
        Optional<LocalDate> end = parseDate(to);
        if (start.isEmpty() || end.isEmpty()) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.INVALID_DATE_RANGE));
        }
        if (end.get().isBefore(start.get())) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.END_DATE_BEFORE_START));
        }
        if (ChronoUnit.DAYS.between(start.get(), end.get()) >= MAX_PLAN_DAYS) {
            return DateRangeOutcome.failed(tooLong());
        }
        return DateRangeOutcome.resolved(expand(start.get(), end.get()));
    }

    /**
     * count가 0 이하이면 WORKDAYS_COUNT_INVALID, 상한을 넘으면 DATE_RANGE_TOO_LONG.
     */
    public static DateRangeOutcome lastWorkdaysOutcome(LocalDate today, int count) {
        if (count <= 0) {
            return DateRangeOutcome.failed(PlanIssue.of(IssueCode.WORKDAYS_COUNT_INVALID));
        }
        if (count > MAX_PLAN_DAYS) {
            return DateRangeOutcome.failed(tooLong());
        }
        return DateRangeOutcome.resolved(lastWorkdays(today, count));
    }

    static PlanIssue tooLong() {
        return PlanIssue.of(IssueCode.DATE_RANGE_TOO_LONG).with("max", MAX_PLAN_DAYS);
    }

    public static Optional<ZoneId> zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * 잘못되거나 비어 있는 시간대는 UTC로 본다.
     */
    public static ZoneId zoneOrUtc(String timezone) {
        return zone(timezone).orElse(ZoneOffset.UTC);
    }
}
