package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentBlock;
import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.IssueCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalExtractorTest {

    private final IntervalExtractor extractor = new IntervalExtractor();

    @Test
    void each_interval_keeps_its_own_label() {
        IntervalExtraction result = extractor.fromPrompt("09:00-12:00 Alpha, 13:00-17:00 Beta", "", null, "");

        assertThat(result.errors()).isEmpty();
        assertThat(result.intervals()).extracting(Interval::projectName).containsExactly("Alpha", "Beta");
        assertThat(result.intervals()).extracting(Interval::startTime).containsExactly("09:00", "13:00");
        assertThat(result.intervals().get(0).projectKey()).isEqualTo("alpha");
    }

    @Test
    void lunch_and_break_labels_become_breaks() {
        IntervalExtraction lunch = extractor.fromPrompt("09:00-12:00 Alpha 12:00-13:00 lunch 13:00-17:00 Alpha", "", null, "");
        IntervalExtraction prefixed = extractor.fromPrompt("break 12:00-13:00 09:00-12:00 Alpha", "", null, "");

        assertThat(lunch.intervals()).extracting(Interval::isBreak).containsExactly(false, true, false);
        assertThat(prefixed.intervals()).extracting(Interval::isBreak).containsExactly(true, false);
        assertThat(prefixed.intervals().get(0).hasProject()).isFalse();
    }

    @Test
    void intent_project_overrides_labels_and_carries_notes() {
        IntervalExtraction result = extractor.fromPrompt("09:00-12:00 Beta", "Alpha", "site visit", "");

        assertThat(result.intervals()).singleElement().satisfies(interval -> {
            assertThat(interval.projectName()).isEqualTo("Alpha");
            assertThat(interval.notes()).isEqualTo("site visit");
        });
    }

    @Test
    void connector_labels_inherit_prompt_project() {
        IntervalExtraction result = extractor.fromPrompt("Alpha 09:00-12:00 and 13:00-17:00", "", null, "");

        assertThat(result.intervals()).extracting(Interval::projectName).containsExactly("Alpha", "Alpha");
    }

    @Test
    void block_labels_and_typographic_dashes_are_normalized() {
        IntervalExtraction result = extractor.fromPrompt("Bloco 1: 09:00–12:00 Alpha", "", null, "");

        assertThat(result.intervals()).singleElement().satisfies(interval -> {
            assertThat(interval.startTime()).isEqualTo("09:00");
            assertThat(interval.endTime()).isEqualTo("12:00");
            assertThat(interval.projectName()).isEqualTo("Alpha");
        });
    }

    @Test
    void invalid_clock_values_are_reported() {
        IntervalExtraction result = extractor.fromPrompt("25:00-26:00 Alpha", "", null, "");

        assertThat(result.intervals()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.INVALID_TIME_RANGE);
            assertThat(issue.message()).isEqualTo("Invalid time range \"25:00-26:00\".");
        });
    }

    @Test
    void intent_without_project_or_schedule_is_rejected() {
        Intent noProject = intent(" ", List.of(new IntentBlock("09:00", "12:00")), List.of());
        Intent noSchedule = intent("Alpha", List.of(), List.of());

        assertThat(extractor.fromIntent(noProject).errors()).extracting(issue -> issue.code()).containsExactly(IssueCode.PROJECT_REQUIRED);
        assertThat(extractor.fromIntent(noSchedule).errors()).extracting(issue -> issue.code()).containsExactly(IssueCode.SCHEDULE_REQUIRED);
    }

    @Test
    void intent_blocks_become_work_and_break_intervals() {
        Intent intent = new Intent(Intent.CREATE_TIMESHEETS, null,
                List.of(new IntentBlock("09:00", "12:00"), new IntentBlock("13:00", "99:00")),
                List.of(new IntentBlock("12:00", "13:00")),
                "“Alpha”", null, "Migration", null, "phase 2", List.of());

        IntervalExtraction result = extractor.fromIntent(intent);

        assertThat(result.intervals()).hasSize(2);
        assertThat(result.intervals().get(0).projectName()).isEqualTo("Alpha");
        assertThat(result.intervals().get(0).notes()).isEqualTo("Migration - phase 2");
        assertThat(result.intervals().get(1).isBreak()).isTrue();
        assertThat(result.errors()).extracting(issue -> issue.code()).containsExactly(IssueCode.INVALID_TIME_RANGE);
    }

    private static Intent intent(String project, List<IntentBlock> schedule, List<IntentBlock> breaks) {
        return new Intent(Intent.CREATE_TIMESHEETS, null, schedule, breaks, project, null, null, null, null, List.of());
    }
}
