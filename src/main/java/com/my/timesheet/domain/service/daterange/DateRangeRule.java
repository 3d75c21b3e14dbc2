package com.my.timesheet.domain.service.daterange;

import java.util.Optional;

/**
 * 왜: 기간 표현 하나당 규칙 하나로 분리해 새 표현을 전체 문법 수정 없이 추가하기 위함.
 */
@FunctionalInterface
public interface DateRangeRule {

    /**
     * @return 규칙이 적용되지 않으면 empty
     */
    Optional<DateRangeOutcome> apply(DateRangeContext context);
}
