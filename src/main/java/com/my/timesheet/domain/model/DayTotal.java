package com.my.timesheet.domain.model;

public record DayTotal(int minutes, double hours) {
}
