package com.my.timesheet.domain.model;

import java.util.Objects;

public record PlanPreviewCommand(
        String eventId,
        long actorId,
        Long technicianId,
        String prompt,
        String timezone,
        String startDate,
        String endDate
) {
    public PlanPreviewCommand {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(prompt, "prompt");
    }
}
