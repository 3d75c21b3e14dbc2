package com.my.timesheet.domain.port.in;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.Plan;
import com.my.timesheet.domain.model.PlanTarget;
import com.my.timesheet.domain.model.ValidationResult;

public interface ValidatePlanUseCase {
    ValidationResult validate(Plan plan, Actor actor, PlanTarget target, boolean enforceBreaks);
}
