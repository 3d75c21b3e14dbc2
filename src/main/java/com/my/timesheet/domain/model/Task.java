package com.my.timesheet.domain.model;

public record Task(long id, long projectId, String name, boolean active) {
}
