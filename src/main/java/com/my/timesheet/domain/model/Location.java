package com.my.timesheet.domain.model;

public record Location(long id, String name, boolean active) {
}
