package com.my.timesheet.domain.model;

/**
 * 왜: 파이프라인 각 단계의 오류/경고 종류를 고정해 표시 계층이 문구와 분류를 독립적으로 다루게 하기 위함.
 */
public enum IssueCode {
    // intent
    AI_UNAVAILABLE("{detail}", null),
    AI_INVALID_JSON("AI intent response is not valid JSON.", null),

    // plan builder
    PROMPT_REQUIRED("Prompt is required.", null),
    DATE_RANGE_REQUIRED("Date range is required.", "date_range"),
    INVALID_DATE_RANGE("Invalid date range.", "date_range"),
    END_DATE_BEFORE_START("End date must be after start date.", "date_range"),
    DATE_RANGE_TOO_LONG("Date range is too long (max {max} days).", "date_range"),
    WORKDAYS_COUNT_INVALID("Workdays count must be greater than zero.", "date_range"),
    DATE_RANGE_NOT_FOUND("Provide a date range or \"last N workdays\" in the prompt.", "date_range"),
    NO_WEEKDAYS("No weekdays found in the requested range.", null),
    PROJECT_REQUIRED("Project is required.", "project"),
    SCHEDULE_REQUIRED("Schedule is required.", "schedule"),
    INVALID_TIME_RANGE("Invalid time range \"{start}-{end}\".", null),
    MISSING_PROJECT_NAME("Missing project name for {start}-{end}.", "project"),
    NO_TIME_INTERVALS("No time intervals found. Use HH:mm-HH:mm format.", "schedule"),
    PROJECT_NOT_FOUND("Project \"{project}\" not found.", "project"),
    PROJECT_AMBIGUOUS("Project name \"{project}\" is ambiguous: {candidates}.", "project"),

    // plan validator
    PERMISSION_DENIED("You do not have permission to create timesheets.", null),
    NO_DAYS("No days were generated for this plan.", null),
    MISSING_DATE("Missing date in plan.", null),
    PLAN_PROJECT_NOT_FOUND("Project {project} not found for {date}.", null),
    NOT_PROJECT_MEMBER("User is not assigned to project \"{project}\" ({date}).", null),
    MISSING_TIME_RANGE("Missing time range for {date}.", null),
    INVALID_ENTRY_TIME("Invalid time range {start}-{end} on {date}.", null),
    END_TIME_NOT_AFTER_START("End time must be after start time for {date} ({start}-{end}).", null),
    TASK_NOT_IN_PROJECT("Task {taskId} is not part of project \"{project}\" ({date}).", "task"),
    PROJECT_HAS_NO_TASKS("Project \"{project}\" has no tasks ({date}).", "task"),
    LOCATION_NOT_FOUND("Location {locationId} not found ({date}).", null),
    NO_LOCATIONS("No locations available for {date}.", null),
    OVERLAPPING_RANGES("Overlapping time ranges detected on {date}.", null),
    DATE_LOCKED("Date {date} is locked by approved/closed entries.", null),
    EXISTING_WITHOUT_TIME("Cannot validate overlaps on {date} due to existing entries without time.", null),
    EXISTING_UNSUPPORTED_TIME("Cannot validate overlaps on {date} due to unsupported existing entry data (invalid time format).", null),
    OVERLAPS_EXISTING("Overlaps with existing entry on {date}.", null),
    DAILY_CAP_EXCEEDED("Daily total exceeds {cap} hours on {date}.", null),
    BREAK_REQUIRED("Break required for continuous work over {hours} hours on {date}.", null),
    NO_ENTRIES("No entries found for {date}.", null),

    // orchestration
    ACTOR_NOT_FOUND("Actor not found.", null),
    TECHNICIAN_FORBIDDEN("Only Owner or Admin can create timesheets for another technician.", null),
    TECHNICIAN_NOT_FOUND("Technician not found.", null),
    TECHNICIAN_PROFILE_NOT_FOUND("Technician profile not found.", null),
    TECHNICIAN_WITHOUT_USER("Technician does not have a linked user.", null),
    REQUEST_ID_REQUIRED("request_id is required.", null),
    NOT_CONFIRMED("confirmed must be true to commit entries.", null),
    PLAN_REQUIRED("plan is required.", null),
    DUPLICATE_REQUEST("Request has already been processed.", null);

    private final String template;
    private final String missingField;

    IssueCode(String template, String missingField) {
        this.template = template;
        this.missingField = missingField;
    }

    public String template() {
        return template;
    }

    /**
     * 사용자에게 되물어야 하는 필드명. 해당 없으면 null.
     */
    public String missingField() {
        return missingField;
    }
}
