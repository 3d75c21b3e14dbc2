package com.my.timesheet.domain.service;

import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.Plan;
import com.my.timesheet.domain.model.PlanBuildResult;
import com.my.timesheet.domain.model.PlanDay;
import com.my.timesheet.domain.model.PlanEntry;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.PlanRequest;
import com.my.timesheet.domain.model.PlanTarget;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.model.TimeSlot;
import com.my.timesheet.domain.port.in.BuildPlanUseCase;
import com.my.timesheet.domain.port.out.ClockPort;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.service.daterange.DateRangeContext;
import com.my.timesheet.domain.service.daterange.DateRangeOutcome;
import com.my.timesheet.domain.service.daterange.DateRangeResolver;
import com.my.timesheet.domain.service.daterange.WorkCalendar;
import com.my.timesheet.domain.service.plan.IntervalExtraction;
import com.my.timesheet.domain.service.plan.IntervalExtractor;
import com.my.timesheet.domain.service.plan.ProjectResolution;
import com.my.timesheet.domain.service.plan.ProjectResolver;
import com.my.timesheet.domain.service.text.BuilderPrompt;
import com.my.timesheet.domain.service.text.ProjectLabels;
import com.my.timesheet.domain.service.text.TextNormalizer;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 의도(또는 원문 프롬프트)를 날짜 x 근무 구간의 계획 골격으로 펼치고, 프로젝트를 확정하며, 실패를 모두 모아 돌려주기 위함.
 *
 * <p>오류가 하나라도 있으면 계획은 만들지 않는다.
 */
public class PlanBuilderService implements BuildPlanUseCase {

    private final ProjectDirectoryPort projectDirectory;
    private final ClockPort clockPort;
    private final DateRangeResolver dateRangeResolver;
    private final IntervalExtractor intervalExtractor;
    private final ProjectResolver projectResolver;

    public PlanBuilderService(ProjectDirectoryPort projectDirectory, ClockPort clockPort) {
        this(projectDirectory, clockPort, new DateRangeResolver(), new IntervalExtractor(), new ProjectResolver(projectDirectory));
    }

    public PlanBuilderService(ProjectDirectoryPort projectDirectory,
                              ClockPort clockPort,
                              DateRangeResolver dateRangeResolver,
                              IntervalExtractor intervalExtractor,
                              ProjectResolver projectResolver) {
        this.projectDirectory = projectDirectory;
        this.clockPort = clockPort;
        this.dateRangeResolver = dateRangeResolver;
        this.intervalExtractor = intervalExtractor;
        this.projectResolver = projectResolver;
    }

    @Override
    public PlanBuildResult build(PlanRequest request, PlanTarget target) {
        List<PlanIssue> warnings = new ArrayList<>();
        Intent intent = request.intent();
        String prompt = request.prompt();
        if (prompt.isEmpty() && intent == null) {
            return PlanBuildResult.invalid(List.of(PlanIssue.of(IssueCode.PROMPT_REQUIRED)), warnings);
        }

        String timezone = TextNormalizer.isBlank(request.timezone()) ? "UTC" : request.timezone();
        LocalDate today = clockPort.now().atZoneSameInstant(WorkCalendar.zoneOrUtc(timezone)).toLocalDate();
        DayOfWeek weekStart = WorkCalendar.resolveWeekStart(request.weekStart());

        DateRangeOutcome range = intent != null
                ? dateRangeResolver.resolveIntent(intent.dateRange(), today, weekStart)
                : dateRangeResolver.resolve(DateRangeContext.of(prompt, request.startDate(), request.endDate(), today, weekStart));
        if (!range.failed()) {
            range = dateRangeResolver.applyWeekdayFilter(range.dates(), prompt);
        }
        if (range.failed()) {
            return PlanBuildResult.invalid(List.of(range.issue()), warnings);
        }

        List<PlanIssue> errors = new ArrayList<>();
        String globalProject = ProjectLabels.extractProjectName(prompt);
        if (intent != null && !globalProject.isEmpty() && !intent.hasProject()) {
            intent = intent.withProject(globalProject);
        }

        List<Interval> intervals = collectIntervals(prompt, intent, errors);
        if (!globalProject.isEmpty()) {
            intervals = applyGlobalProject(intervals, globalProject);
            errors.removeIf(issue -> issue.code() == IssueCode.PROJECT_REQUIRED);
        }
        if (intervals.isEmpty()) {
            if (errors.isEmpty()) {
                errors.add(PlanIssue.of(IssueCode.NO_TIME_INTERVALS));
            }
            return PlanBuildResult.invalid(errors, warnings);
        }

        ProjectResolution resolution = projectResolver.resolve(intervals);
        errors.addAll(resolution.errors());
        if (!errors.isEmpty()) {
            return PlanBuildResult.invalid(errors, warnings);
        }

        List<TimeSlot> breaks = intervals.stream()
                .filter(Interval::isBreak)
                .map(interval -> new TimeSlot(interval.startTime(), interval.endTime()))
                .toList();
        List<PlanEntry> entries = new ArrayList<>();
        for (Interval interval : intervals) {
            if (interval.isBreak()) {
                continue;
            }
            Project project = resolution.project(interval.projectKey()).orElseThrow();
            entries.add(PlanEntry.of(project.id(), project.name(), interval.startTime(), interval.endTime(), interval.notes()));
        }

        List<PlanDay> days = range.dates().stream()
                .map(date -> new PlanDay(date, entries, breaks))
                .toList();
        Plan plan = new Plan(prompt, timezone, target.userId(), target.technician().id(), days);
        return new PlanBuildResult(plan, errors, warnings);
    }

    private List<Interval> collectIntervals(String prompt, Intent intent, List<PlanIssue> errors) {
        String builderProject = resolveBuilderProject(prompt).orElse("");
        if (intent == null) {
            IntervalExtraction fromPrompt = intervalExtractor.fromPrompt(prompt, "", null, builderProject);
            errors.addAll(fromPrompt.errors());
            return fromPrompt.intervals();
        }

        IntervalExtraction fromIntent = intervalExtractor.fromIntent(intent);
        String hint = intent.project() == null ? "" : intent.project().trim();
        IntervalExtraction fromPrompt = intervalExtractor.fromPrompt(prompt, hint, intent.mergedNotes(), builderProject);
        errors.addAll(fromIntent.errors());
        errors.addAll(fromPrompt.errors());
        if (!fromPrompt.intervals().isEmpty()) {
            errors.removeIf(issue -> issue.code() == IssueCode.PROJECT_REQUIRED || issue.code() == IssueCode.SCHEDULE_REQUIRED);
        }
        return merge(fromIntent.intervals(), fromPrompt.intervals());
    }

    /**
     * 의도 쪽 구간을 먼저 두고, 같은 키의 프롬프트 구간은 버린다.
     */
    private static List<Interval> merge(List<Interval> primary, List<Interval> secondary) {
        List<Interval> merged = new ArrayList<>(primary);
        Set<String> seen = new LinkedHashSet<>();
        primary.forEach(interval -> seen.add(interval.dedupKey()));
        for (Interval interval : secondary) {
            if (seen.add(interval.dedupKey())) {
                merged.add(interval);
            }
        }
        return merged;
    }

    private static List<Interval> applyGlobalProject(List<Interval> intervals, String globalProject) {
        String project = TextNormalizer.normalizeLabel(globalProject);
        if (project.isEmpty()) {
            return intervals;
        }
        return intervals.stream()
                .map(interval -> interval.isBreak() || interval.hasProject() ? interval : interval.withProject(project))
                .toList();
    }

    /**
     * 빌더 형식 프롬프트의 project 줄을 디렉터리 이름으로 확정한다.
     * 여러 프로젝트와 일치하면 적힌 이름을 그대로 넘겨 ProjectResolver가 모호 오류를 내게 한다.
     */
    private Optional<String> resolveBuilderProject(String prompt) {
        if (!BuilderPrompt.looksLikeBuilderPrompt(prompt)) {
            return Optional.empty();
        }
        Optional<String> name = BuilderPrompt.extractProject(prompt);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        List<Project> matches = projectDirectory.findProjectsByName(name.get());
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(matches.size() == 1 ? matches.get(0).name() : name.get());
    }
}
