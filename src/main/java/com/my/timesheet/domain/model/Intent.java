package com.my.timesheet.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: AI 결과와 로컬 추출 결과를 하나의 정규 형태로 합쳐 계획 생성 단계에 넘기기 위함.
 */
public record Intent(
        String intent,
        IntentDateRange dateRange,
        List<IntentBlock> schedule,
        List<IntentBlock> breaks,
        String project,
        String task,
        String description,
        String location,
        String notes,
        List<String> missingFields
) {

    public static final String CREATE_TIMESHEETS = "create_timesheets";

    public Intent {
        intent = intent == null ? "" : intent;
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public Intent withProject(String value) {
        return new Intent(intent, dateRange, schedule, breaks, value, task, description, location, notes, without("project"));
    }

    public Intent withTask(String value) {
        return new Intent(intent, dateRange, schedule, breaks, project, value, description, location, notes, without("task"));
    }

    public Intent withDescription(String value) {
        return new Intent(intent, dateRange, schedule, breaks, project, task, value, location, notes, without("description"));
    }

    public Intent withNotes(String value) {
        return new Intent(intent, dateRange, schedule, breaks, project, task, description, location, value, without("notes"));
    }

    public Intent withDateRange(IntentDateRange value) {
        return new Intent(intent, value, schedule, breaks, project, task, description, location, notes, without("date_range"));
    }

    public boolean hasProject() {
        return project != null && !project.isBlank();
    }

    /**
     * 설명과 메모를 "설명 - 메모" 형태로 합친다. 둘 다 없으면 null.
     */
    public String mergedNotes() {
        String d = description == null ? "" : description.trim();
        String n = notes == null ? "" : notes.trim();
        if (!d.isEmpty() && !n.isEmpty()) {
            return d + " - " + n;
        }
        if (!n.isEmpty()) {
            return n;
        }
        return d.isEmpty() ? null : d;
    }

    private List<String> without(String field) {
        return missingFields.stream()
                .filter(missing -> !Objects.equals(missing, field))
                .toList();
    }
}
