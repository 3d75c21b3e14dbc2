package com.my.timesheet.domain.model;

import java.time.LocalDate;
import java.util.List;

public record PlanDay(LocalDate date, List<PlanEntry> entries, List<TimeSlot> breaks) {

    public PlanDay {
        entries = entries == null ? List.of() : List.copyOf(entries);
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
    }
}
