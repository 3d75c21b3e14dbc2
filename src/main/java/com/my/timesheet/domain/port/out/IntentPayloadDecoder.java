package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.Intent;

import java.util.Optional;

/**
 * 왜: AI 응답 문자열의 JSON 해석을 특정 라이브러리와 분리해 도메인을 직렬화 구현에서 독립시키기 위함.
 */
public interface IntentPayloadDecoder {
    /**
     * 응답 전체가 JSON 객체가 아니면 첫 번째 {...} 구간으로 한 번 더 시도한다.
     *
     * @return 해석 불가하면 empty
     */
    Optional<Intent> decode(String text);
}
