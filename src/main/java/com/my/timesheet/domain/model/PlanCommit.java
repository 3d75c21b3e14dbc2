package com.my.timesheet.domain.model;

import java.util.List;

public record PlanCommit(List<PlanIssue> errors, List<Long> createdIds, Totals totals) {

    public PlanCommit {
        errors = errors == null ? List.of() : List.copyOf(errors);
        createdIds = createdIds == null ? List.of() : List.copyOf(createdIds);
    }

    public static PlanCommit failed(List<PlanIssue> errors) {
        return new PlanCommit(errors, List.of(), null);
    }

    public boolean ok() {
        return errors.isEmpty();
    }

    public int createdCount() {
        return createdIds.size();
    }
}
