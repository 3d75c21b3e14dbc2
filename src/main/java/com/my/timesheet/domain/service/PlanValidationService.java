package com.my.timesheet.domain.service;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.DayTotal;
import com.my.timesheet.domain.model.ExistingTimesheet;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.Location;
import com.my.timesheet.domain.model.NormalizedDay;
import com.my.timesheet.domain.model.NormalizedEntry;
import com.my.timesheet.domain.model.NormalizedPlan;
import com.my.timesheet.domain.model.Plan;
import com.my.timesheet.domain.model.PlanDay;
import com.my.timesheet.domain.model.PlanEntry;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.PlanTarget;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.model.Task;
import com.my.timesheet.domain.model.TimeSlot;
import com.my.timesheet.domain.model.TimesheetPolicy;
import com.my.timesheet.domain.model.Totals;
import com.my.timesheet.domain.model.ValidationResult;
import com.my.timesheet.domain.port.in.ValidatePlanUseCase;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.port.out.TimesheetStorePort;
import com.my.timesheet.domain.service.text.TimeOfDay;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 계획 골격을 현재 저장소 상태와 테넌트 정책에 대조해 저장 가능한 확정 계획으로 만들고, 모든 위반을 한 번에 보고하기 위함.
 *
 * <p>항목 단위 오류는 해당 항목만 건너뛰고 계속 진행한다. 기존 항목 대조는 일자별로 첫 위반에서 멈춘다.
 */
public class PlanValidationService implements ValidatePlanUseCase {

    private static final Logger log = Logger.getLogger(PlanValidationService.class);

    private final ProjectDirectoryPort projectDirectory;
    private final TimesheetStorePort timesheetStore;
    private final TimesheetPolicy policy;

    public PlanValidationService(ProjectDirectoryPort projectDirectory, TimesheetStorePort timesheetStore, TimesheetPolicy policy) {
        this.projectDirectory = projectDirectory;
        this.timesheetStore = timesheetStore;
        this.policy = policy;
    }

    @Override
    public ValidationResult validate(Plan plan, Actor actor, PlanTarget target, boolean enforceBreaks) {
        List<PlanIssue> errors = new ArrayList<>();
        List<PlanIssue> warnings = new ArrayList<>();

        if (!actor.can(Actor.CREATE_TIMESHEETS)) {
            errors.add(PlanIssue.of(IssueCode.PERMISSION_DENIED));
        }
        List<PlanDay> days = plan == null ? List.of() : mergeSameDate(plan.days());
        if (days.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.NO_DAYS));
        }

        List<NormalizedDay> normalizedDays = new ArrayList<>();
        Map<LocalDate, DayTotal> perDay = new LinkedHashMap<>();
        int overallMinutes = 0;

        for (PlanDay day : days) {
            LocalDate date = day.date();
            if (date == null) {
                errors.add(PlanIssue.of(IssueCode.MISSING_DATE));
                continue;
            }
            if (day.entries().isEmpty()) {
                warnings.add(PlanIssue.of(IssueCode.NO_ENTRIES).with("date", date));
            }

            List<NormalizedEntry> entries = new ArrayList<>();
            int planMinutes = 0;
            for (PlanEntry entry : day.entries()) {
                Optional<NormalizedEntry> normalized = normalizeEntry(entry, date, target, errors);
                if (normalized.isPresent()) {
                    entries.add(normalized.get());
                    planMinutes += normalized.get().minutes();
                }
            }
            overallMinutes += planMinutes;

            entries.sort(Comparator.comparingInt(this::startMinutes));
            checkNoOverlap(entries, date, errors);
            checkAgainstExisting(target.technician().id(), date, entries, planMinutes, errors);
            perDay.put(date, new DayTotal(planMinutes, hours(planMinutes)));
            checkBreaks(entries, date, enforceBreaks, errors, warnings);

            normalizedDays.add(new NormalizedDay(date, entries, day.breaks()));
        }

        NormalizedPlan normalizedPlan = new NormalizedPlan(
                plan == null ? null : plan.prompt(),
                plan == null ? null : plan.timezone(),
                target.userId(),
                target.technician().id(),
                normalizedDays);
        Totals totals = new Totals(overallMinutes, hours(overallMinutes), perDay);
        return new ValidationResult(errors, warnings, normalizedPlan, totals);
    }

    /**
     * 같은 날짜의 PlanDay는 하나로 합친다. 겹침과 일일 상한은 날짜 단위로만 의미가 있다.
     */
    private static List<PlanDay> mergeSameDate(List<PlanDay> days) {
        List<PlanDay> undated = new ArrayList<>();
        Map<LocalDate, List<PlanEntry>> entriesByDate = new LinkedHashMap<>();
        Map<LocalDate, List<TimeSlot>> breaksByDate = new LinkedHashMap<>();
        for (PlanDay day : days) {
            if (day.date() == null) {
                undated.add(day);
                continue;
            }
            entriesByDate.computeIfAbsent(day.date(), d -> new ArrayList<>()).addAll(day.entries());
            breaksByDate.computeIfAbsent(day.date(), d -> new ArrayList<>()).addAll(day.breaks());
        }
        if (entriesByDate.size() + undated.size() < days.size()) {
            log.debugf("같은 날짜 PlanDay 병합: %d -> %d", days.size(), entriesByDate.size() + undated.size());
        }
        List<PlanDay> merged = new ArrayList<>(undated);
        entriesByDate.forEach((date, entries) -> merged.add(new PlanDay(date, entries, breaksByDate.get(date))));
        return merged;
    }

    private Optional<NormalizedEntry> normalizeEntry(PlanEntry entry, LocalDate date, PlanTarget target, List<PlanIssue> errors) {
        Optional<Project> found = entry.projectId() == null || entry.projectId() <= 0
                ? Optional.empty()
                : projectDirectory.findProject(entry.projectId());
        if (found.isEmpty()) {
            String name = entry.projectName() == null ? "unknown" : entry.projectName();
            errors.add(PlanIssue.of(IssueCode.PLAN_PROJECT_NOT_FOUND).with("project", name).with("date", date));
            return Optional.empty();
        }
        Project project = found.get();
        if (!projectDirectory.isProjectMember(project.id(), target.userId())) {
            errors.add(PlanIssue.of(IssueCode.NOT_PROJECT_MEMBER).with("project", project.name()).with("date", date));
            return Optional.empty();
        }

        String start = entry.startTime() == null ? "" : entry.startTime();
        String end = entry.endTime() == null ? "" : entry.endTime();
        if (start.isEmpty() || end.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.MISSING_TIME_RANGE).with("date", date));
            return Optional.empty();
        }
        Optional<Integer> startMinutes = TimeOfDay.toMinutes(start);
        Optional<Integer> endMinutes = TimeOfDay.toMinutes(end);
        if (startMinutes.isEmpty() || endMinutes.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.INVALID_ENTRY_TIME).with("start", start).with("end", end).with("date", date));
            return Optional.empty();
        }
        if (endMinutes.get() <= startMinutes.get()) {
            errors.add(PlanIssue.of(IssueCode.END_TIME_NOT_AFTER_START).with("date", date).with("start", start).with("end", end));
            return Optional.empty();
        }

        Optional<Task> task = resolveTask(project, entry, date, errors);
        if (task.isEmpty()) {
            return Optional.empty();
        }
        Optional<Location> location = resolveLocation(task.get(), entry, date, errors);
        if (location.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new NormalizedEntry(
                project.id(),
                project.name(),
                task.get().id(),
                task.get().name(),
                location.get().id(),
                location.get().name(),
                date,
                start,
                end,
                endMinutes.get() - startMinutes.get(),
                entry.notes()));
    }

    private Optional<Task> resolveTask(Project project, PlanEntry entry, LocalDate date, List<PlanIssue> errors) {
        if (entry.taskId() != null && entry.taskId() > 0) {
            Optional<Task> task = projectDirectory.findTask(entry.taskId(), project.id());
            if (task.isEmpty()) {
                errors.add(PlanIssue.of(IssueCode.TASK_NOT_IN_PROJECT)
                        .with("taskId", entry.taskId())
                        .with("project", project.name())
                        .with("date", date));
            }
            return task;
        }
        Optional<Task> task = projectDirectory.findDefaultTask(project.id());
        if (task.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.PROJECT_HAS_NO_TASKS).with("project", project.name()).with("date", date));
        }
        return task;
    }

    private Optional<Location> resolveLocation(Task task, PlanEntry entry, LocalDate date, List<PlanIssue> errors) {
        if (entry.locationId() != null && entry.locationId() > 0) {
            Optional<Location> location = projectDirectory.findLocation(entry.locationId());
            if (location.isEmpty()) {
                errors.add(PlanIssue.of(IssueCode.LOCATION_NOT_FOUND).with("locationId", entry.locationId()).with("date", date));
            }
            return location;
        }
        Optional<Location> location = projectDirectory.findFirstTaskLocation(task.id())
                .or(projectDirectory::findFallbackLocation);
        if (location.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.NO_LOCATIONS).with("date", date));
        }
        return location;
    }

    /**
     * 정렬된 항목에서 이웃끼리 겹치면 일자당 한 번만 보고한다.
     */
    private void checkNoOverlap(List<NormalizedEntry> entries, LocalDate date, List<PlanIssue> errors) {
        for (int i = 1; i < entries.size(); i++) {
            if (startMinutes(entries.get(i)) < endMinutes(entries.get(i - 1))) {
                errors.add(PlanIssue.of(IssueCode.OVERLAPPING_RANGES).with("date", date));
                return;
            }
        }
    }

    private void checkAgainstExisting(long technicianId, LocalDate date, List<NormalizedEntry> entries, int planMinutes, List<PlanIssue> errors) {
        List<ExistingTimesheet> existing = timesheetStore.findEntries(technicianId, date);

        if (existing.stream().anyMatch(ExistingTimesheet::locksDate)) {
            errors.add(PlanIssue.of(IssueCode.DATE_LOCKED).with("date", date));
            return;
        }
        if (existing.stream().anyMatch(ExistingTimesheet::missingTime)) {
            log.debugf("시간 없는 기존 항목으로 겹침 검증 불가: technician=%d, date=%s, existing=%d", (Object) technicianId, date, existing.size());
            errors.add(PlanIssue.of(IssueCode.EXISTING_WITHOUT_TIME).with("date", date));
            return;
        }

        for (NormalizedEntry entry : entries) {
            for (ExistingTimesheet current : existing) {
                Optional<Integer> start = TimeOfDay.toMinutes(current.startTime());
                Optional<Integer> end = TimeOfDay.toMinutes(current.endTime());
                if (start.isEmpty() || end.isEmpty()) {
                    log.debugf("기존 항목 시간 형식 해석 불가: id=%d, start=%s, end=%s", current.id(), current.startTime(), current.endTime());
                    errors.add(PlanIssue.of(IssueCode.EXISTING_UNSUPPORTED_TIME).with("date", date));
                    return;
                }
                // 반개구간: 끝과 시작이 맞닿는 것은 겹침이 아니다
                if (startMinutes(entry) < end.get() && start.get() < endMinutes(entry)) {
                    errors.add(PlanIssue.of(IssueCode.OVERLAPS_EXISTING).with("date", date));
                    return;
                }
            }
        }

        double existingHours = existing.stream()
                .map(ExistingTimesheet::hoursWorked)
                .filter(hours -> hours != null)
                .mapToDouble(Double::doubleValue)
                .sum();
        int totalMinutes = (int) Math.round(existingHours * 60) + planMinutes;
        if (totalMinutes > policy.dailyCapMinutes()) {
            errors.add(PlanIssue.of(IssueCode.DAILY_CAP_EXCEEDED).with("cap", plainNumber(policy.dailyHourCap())).with("date", date));
        }
    }

    /**
     * 간격이 최소 휴식보다 짧으면 같은 연속 근무 블록으로 본다.
     */
    private void checkBreaks(List<NormalizedEntry> entries, LocalDate date, boolean enforceBreaks,
                             List<PlanIssue> errors, List<PlanIssue> warnings) {
        if (entries.isEmpty()) {
            return;
        }
        int breakAfter = policy.breakRequiredAfterMinutes();
        Integer blockStart = null;
        int blockEnd = 0;
        int maxContinuous = 0;
        for (NormalizedEntry entry : entries) {
            int start = startMinutes(entry);
            int end = endMinutes(entry);
            if (blockStart == null || start - blockEnd >= policy.breakMinMinutes()) {
                blockStart = start;
                blockEnd = end;
            } else {
                blockEnd = Math.max(blockEnd, end);
            }
            maxContinuous = Math.max(maxContinuous, blockEnd - blockStart);
        }
        if (maxContinuous > breakAfter) {
            PlanIssue issue = PlanIssue.of(IssueCode.BREAK_REQUIRED)
                    .with("hours", String.format(Locale.ROOT, "%.1f", breakAfter / 60.0))
                    .with("date", date);
            if (enforceBreaks) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
    }

    private int startMinutes(NormalizedEntry entry) {
        return TimeOfDay.toMinutes(entry.startTime()).orElse(0);
    }

    private int endMinutes(NormalizedEntry entry) {
        return TimeOfDay.toMinutes(entry.endTime()).orElse(0);
    }

    static double hours(int minutes) {
        return BigDecimal.valueOf(minutes).divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String plainNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
