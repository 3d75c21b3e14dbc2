package com.my.timesheet.domain.model;

public record Project(long id, String name) {
}
