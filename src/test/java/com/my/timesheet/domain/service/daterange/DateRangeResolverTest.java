package com.my.timesheet.domain.service.daterange;

import com.my.timesheet.domain.model.IntentDateRange;
import com.my.timesheet.domain.model.IssueCode;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class DateRangeResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 2, 11);

    private final DateRangeResolver resolver = new DateRangeResolver();

    private DateRangeOutcome resolve(String prompt) {
        return resolve(prompt, null, null);
    }

    private DateRangeOutcome resolve(String prompt, String startDate, String endDate) {
        return resolver.resolve(DateRangeContext.of(prompt, startDate, endDate, TODAY, DayOfWeek.MONDAY));
    }

    private static LocalDate feb(int day) {
        return LocalDate.of(2026, 2, day);
    }

    @Test
    void date_range_token_wins_over_request_bounds() {
        DateRangeOutcome outcome = resolve("DATE_RANGE=2026-02-10..2026-02-12\n09:00-12:00", "2026-03-01", "2026-03-02");

        assertThat(outcome.dates()).containsExactly(feb(10), feb(11), feb(12));
    }

    @Test
    void single_request_bound_means_one_day() {
        assertThat(resolve("worked on alpha", "2026-02-10", null).dates()).containsExactly(feb(10));
        assertThat(resolve("worked on alpha", " ", "2026-02-09").dates()).containsExactly(feb(9));
    }

    @Test
    void last_n_workdays_in_english_and_portuguese() {
        assertThat(resolve("last 3 workdays 09:00-17:00 Alpha").dates()).containsExactly(feb(9), feb(10), feb(11));
        assertThat(resolve("últimos 2 dias úteis 09:00-17:00 Alpha").dates()).containsExactly(feb(10), feb(11));
    }

    @Test
    void zero_workdays_is_rejected() {
        assertThat(resolve("last 0 workdays").issue().code()).isEqualTo(IssueCode.WORKDAYS_COUNT_INVALID);
    }

    @Test
    void huge_workday_counts_are_rejected_before_expanding() {
        assertThat(resolve("last 100000000 workdays 09:00-17:00 Alpha").issue().code()).isEqualTo(IssueCode.DATE_RANGE_TOO_LONG);
        assertThat(resolve("last 99999999999999 workdays").issue().code()).isEqualTo(IssueCode.DATE_RANGE_TOO_LONG);
        assertThat(resolve("DATE_RANGE=2020-01-01..2026-02-11").issue().code()).isEqualTo(IssueCode.DATE_RANGE_TOO_LONG);
        assertThat(resolver.resolveIntent(IntentDateRange.relative("last_n_workdays", Integer.MAX_VALUE), TODAY, DayOfWeek.MONDAY)
                .issue().code()).isEqualTo(IssueCode.DATE_RANGE_TOO_LONG);
    }

    @Test
    void relative_weeks_use_week_start() {
        assertThat(resolve("semana passada 09:00-17:00").dates()).hasSize(7).startsWith(feb(2)).endsWith(feb(8));
        assertThat(resolve("Próxima semana 09:00-17:00").dates()).startsWith(feb(16)).endsWith(feb(22));
        assertThat(resolve("esta semana").dates()).startsWith(feb(9)).endsWith(feb(15));
    }

    @Test
    void labeled_ranges_in_both_languages() {
        assertThat(resolve("from 2026-02-10 to 2026-02-12 09:00-12:00 Alpha").dates()).hasSize(3);
        assertThat(resolve("entre 2026-02-10 e 2026-02-11 09:00-12:00 Alpha").dates()).containsExactly(feb(10), feb(11));
        assertThat(resolve("de 2026-02-09 até 2026-02-10").dates()).containsExactly(feb(9), feb(10));
        assertThat(resolve("between 2026-02-10 and 2026-02-10").dates()).containsExactly(feb(10));
    }

    @Test
    void reversed_labeled_range_is_an_error() {
        assertThat(resolve("2026-02-10 - 2026-02-09").issue().code()).isEqualTo(IssueCode.END_DATE_BEFORE_START);
    }

    @Test
    void prompt_without_range_is_not_found() {
        DateRangeOutcome outcome = resolve("09:00-17:00 Alpha");

        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.issue().code()).isEqualTo(IssueCode.DATE_RANGE_NOT_FOUND);
        assertThat(outcome.issue().message()).isEqualTo("Provide a date range or \"last N workdays\" in the prompt.");
    }

    @Test
    void intent_ranges() {
        assertThat(resolver.resolveIntent(null, TODAY, DayOfWeek.MONDAY).issue().code())
                .isEqualTo(IssueCode.DATE_RANGE_REQUIRED);
        assertThat(resolver.resolveIntent(IntentDateRange.absolute("2026-02-10", "2026-02-11"), TODAY, DayOfWeek.MONDAY).dates())
                .containsExactly(feb(10), feb(11));
        assertThat(resolver.resolveIntent(IntentDateRange.relative("last_n_workdays", 2), TODAY, DayOfWeek.MONDAY).dates())
                .containsExactly(feb(10), feb(11));
        assertThat(resolver.resolveIntent(IntentDateRange.relative("LAST_WEEK", null), TODAY, DayOfWeek.MONDAY).dates())
                .startsWith(feb(2));
    }

    @Test
    void intent_range_keywords_are_matched_under_turkish_default_locale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertThat(resolver.resolveIntent(new IntentDateRange("RELATIVE", null, null, "THIS_WEEK", null), TODAY, DayOfWeek.MONDAY).dates())
                    .startsWith(feb(9)).endsWith(feb(15));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void intent_range_errors() {
        assertThat(resolver.resolveIntent(IntentDateRange.relative("last_n_workdays", 0), TODAY, DayOfWeek.MONDAY).issue().code())
                .isEqualTo(IssueCode.WORKDAYS_COUNT_INVALID);
        assertThat(resolver.resolveIntent(IntentDateRange.relative("yesterday", null), TODAY, DayOfWeek.MONDAY).issue().code())
                .isEqualTo(IssueCode.INVALID_DATE_RANGE);
        assertThat(resolver.resolveIntent(new IntentDateRange("fuzzy", null, null, null, null), TODAY, DayOfWeek.MONDAY).issue().code())
                .isEqualTo(IssueCode.INVALID_DATE_RANGE);
    }

    @Test
    void weekday_filter_drops_weekends_only_when_asked() {
        List<LocalDate> fridayToMonday = WorkCalendar.expand(feb(6), feb(9));

        assertThat(resolver.applyWeekdayFilter(fridayToMonday, "mon-fri 09:00-17:00").dates()).containsExactly(feb(6), feb(9));
        assertThat(resolver.applyWeekdayFilter(fridayToMonday, "seg a sexta").dates()).containsExactly(feb(6), feb(9));
        assertThat(resolver.applyWeekdayFilter(fridayToMonday, "every day").dates()).hasSize(4);
    }

    @Test
    void weekday_filter_on_weekend_only_range_fails() {
        DateRangeOutcome outcome = resolver.applyWeekdayFilter(WorkCalendar.expand(feb(7), feb(8)), "Monday to Friday");

        assertThat(outcome.issue().code()).isEqualTo(IssueCode.NO_WEEKDAYS);
    }

    @Test
    void custom_rule_list_is_evaluated_in_order() {
        DateRangeResolver onlyWeeks = new DateRangeResolver(List.of(new RelativeWeekRule()));

        DateRangeOutcome outcome = onlyWeeks.resolve(DateRangeContext.of("last 3 workdays", null, null, TODAY, DayOfWeek.MONDAY));

        assertThat(outcome.issue().code()).isEqualTo(IssueCode.DATE_RANGE_NOT_FOUND);
    }
}
