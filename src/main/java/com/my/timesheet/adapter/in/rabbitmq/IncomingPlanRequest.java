package com.my.timesheet.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.timesheet.domain.exception.InvalidRequestException;
import com.my.timesheet.domain.model.Plan;
import com.my.timesheet.domain.model.PlanCommitCommand;
import com.my.timesheet.domain.model.PlanPreviewCommand;

import java.util.Locale;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingPlanRequest(String eventId,
                                  String action,
                                  Long actorId,
                                  Long technicianId,
                                  String prompt,
                                  String timezone,
                                  String startDate,
                                  String endDate,
                                  String requestId,
                                  Boolean confirmed,
                                  Plan plan) {

    public enum Action {
        PREVIEW,
        COMMIT
    }

    public IncomingPlanRequest {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actorId, "actorId");
        if (eventId.isBlank()) {
            throw new InvalidRequestException("요청 필드가 비어 있습니다.");
        }
    }

    public Action resolveAction() {
        try {
            return Action.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 action입니다: " + action, e);
        }
    }

    public PlanPreviewCommand toPreviewCommand() {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidRequestException("prompt가 비어 있습니다.");
        }
        if (prompt.length() > 2000) {
            throw new InvalidRequestException("prompt가 너무 깁니다.");
        }
        return new PlanPreviewCommand(eventId, actorId, technicianId, prompt, timezone, startDate, endDate);
    }

    public PlanCommitCommand toCommitCommand() {
        return new PlanCommitCommand(eventId, actorId, technicianId, requestId, Boolean.TRUE.equals(confirmed), plan);
    }
}
