package com.my.timesheet.domain.service;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.ApplyResult;
import com.my.timesheet.domain.model.DraftTimesheet;
import com.my.timesheet.domain.model.NormalizedDay;
import com.my.timesheet.domain.model.NormalizedEntry;
import com.my.timesheet.domain.model.NormalizedPlan;
import com.my.timesheet.domain.model.TimesheetStatus;
import com.my.timesheet.domain.port.in.ApplyPlanUseCase;
import com.my.timesheet.domain.port.out.TimesheetStorePort;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 확정 계획의 항목마다 초안 타임시트를 만들어 커밋 키와 함께 한 번에 기록하고 생성된 id를 순서대로 돌려주기 위함.
 */
public class PlanApplyService implements ApplyPlanUseCase {

    private final TimesheetStorePort timesheetStore;

    public PlanApplyService(TimesheetStorePort timesheetStore) {
        this.timesheetStore = timesheetStore;
    }

    @Override
    public ApplyResult apply(NormalizedPlan plan, Actor actor, String commitKey) {
        List<DraftTimesheet> drafts = new ArrayList<>();
        for (NormalizedDay day : plan.days()) {
            for (NormalizedEntry entry : day.entries()) {
                DraftTimesheet draft = new DraftTimesheet(
                        plan.technicianId(),
                        entry.projectId(),
                        entry.taskId(),
                        entry.locationId(),
                        day.date(),
                        entry.startTime(),
                        entry.endTime(),
                        BigDecimal.valueOf(entry.minutes()).divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP),
                        entry.notes(),
                        TimesheetStatus.DRAFT,
                        actor.id(),
                        actor.id());
                drafts.add(draft);
            }
        }
        return new ApplyResult(timesheetStore.createDrafts(commitKey, drafts));
    }
}
