package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.DraftTimesheet;
import com.my.timesheet.domain.model.ExistingTimesheet;

import java.time.LocalDate;
import java.util.List;

/**
 * 왜: 기존 타임시트 조회와 초안 기록을 하나의 저장소 계약으로 분리하기 위함.
 */
public interface TimesheetStorePort {

    List<ExistingTimesheet> findEntries(long technicianId, LocalDate date);

    /**
     * 커밋 키 기록과 모든 초안 삽입을 한 트랜잭션으로 처리한다. 하나라도 실패하면 아무것도 남지 않는다.
     *
     * @return 삽입 순서대로의 생성 id
     * @throws com.my.timesheet.domain.exception.DuplicateCommitException 같은 커밋 키가 이미 기록된 경우
     */
    List<Long> createDrafts(String commitKey, List<DraftTimesheet> drafts);
}
