package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.PlanIssue;

import java.util.List;

public record IntervalExtraction(List<Interval> intervals, List<PlanIssue> errors) {

    public IntervalExtraction {
        intervals = List.copyOf(intervals);
        errors = List.copyOf(errors);
    }
}
