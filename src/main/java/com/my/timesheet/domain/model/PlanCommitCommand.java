package com.my.timesheet.domain.model;

import java.util.Objects;

/**
 * 왜: 사용자가 확인한 미리보기 계획을 확정 저장하기 위한 입력. requestId로 중복 커밋을 식별한다.
 */
public record PlanCommitCommand(
        String eventId,
        long actorId,
        Long technicianId,
        String requestId,
        boolean confirmed,
        Plan plan
) {
    public PlanCommitCommand {
        Objects.requireNonNull(eventId, "eventId");
    }

    /**
     * 요청자별 requestId. 같은 requestId라도 요청자가 다르면 다른 커밋이다.
     */
    public String commitKey() {
        return actorId + ":" + requestId;
    }
}
