package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.LlmResponse;

/**
 * 왜: LLM 호출을 추상화하여 도메인이 공급자나 프로토콜에 의존하지 않도록 하기 위함.
 */
public interface LlmPort {
    /**
     * 응답 원문은 JSON 객체이거나 JSON 객체를 포함한 텍스트로 기대한다.
     */
    LlmResponse parseTimesheetIntent(String prompt, String timezone, String weekStart);
}
