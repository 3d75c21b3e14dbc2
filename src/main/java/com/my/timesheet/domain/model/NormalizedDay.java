package com.my.timesheet.domain.model;

import java.time.LocalDate;
import java.util.List;

public record NormalizedDay(LocalDate date, List<NormalizedEntry> entries, List<TimeSlot> breaks) {

    public NormalizedDay {
        entries = entries == null ? List.of() : List.copyOf(entries);
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
    }
}
