package com.my.timesheet.domain.port.in;

import com.my.timesheet.domain.model.IntentRequest;
import com.my.timesheet.domain.model.IntentResult;

/**
 * 왜: 자유 문장과 AI 결과를 정규 의도로 합치는 단일 진입점을 제공하기 위함.
 */
public interface ExtractIntentUseCase {
    IntentResult extract(IntentRequest request);
}
