package com.my.timesheet.domain.port.in;

import com.my.timesheet.domain.model.PlanCommit;
import com.my.timesheet.domain.model.PlanCommitCommand;
import com.my.timesheet.domain.model.PlanPreview;
import com.my.timesheet.domain.model.PlanPreviewCommand;

/**
 * 왜: 미리보기 후 확인 시 저장하는 흐름을 외부 입력 어댑터가 하나의 계약으로 사용하게 하기 위함.
 */
public interface TimesheetPlanUseCase {

    PlanPreview preview(PlanPreviewCommand command);

    PlanCommit commit(PlanCommitCommand command);
}
