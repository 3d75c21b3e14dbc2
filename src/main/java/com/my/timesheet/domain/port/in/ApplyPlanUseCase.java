package com.my.timesheet.domain.port.in;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.ApplyResult;
import com.my.timesheet.domain.model.NormalizedPlan;

/**
 * 왜: 검증을 통과한 계획만 저장하도록 저장 단계를 별도 진입점으로 분리하기 위함.
 */
public interface ApplyPlanUseCase {
    ApplyResult apply(NormalizedPlan plan, Actor actor, String commitKey);
}
