package com.my.timesheet.domain.model;

import java.util.List;

public record ApplyResult(List<Long> createdIds) {

    public ApplyResult {
        createdIds = createdIds == null ? List.of() : List.copyOf(createdIds);
    }

    public int createdCount() {
        return createdIds.size();
    }
}
