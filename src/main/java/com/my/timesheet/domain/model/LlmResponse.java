package com.my.timesheet.domain.model;

/**
 * 왜: 외부 AI 호출 결과를 성공 여부와 원문 응답만으로 표현해 공급자 세부사항을 숨기기 위함.
 */
public record LlmResponse(boolean success, String response, String error) {

    public static LlmResponse success(String response) {
        return new LlmResponse(true, response, null);
    }

    public static LlmResponse failure(String error) {
        return new LlmResponse(false, null, error);
    }
}
