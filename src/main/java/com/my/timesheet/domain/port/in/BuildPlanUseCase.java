package com.my.timesheet.domain.port.in;

import com.my.timesheet.domain.model.PlanBuildResult;
import com.my.timesheet.domain.model.PlanRequest;
import com.my.timesheet.domain.model.PlanTarget;

public interface BuildPlanUseCase {
    PlanBuildResult build(PlanRequest request, PlanTarget target);
}
