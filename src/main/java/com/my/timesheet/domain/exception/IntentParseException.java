package com.my.timesheet.domain.exception;

/**
 * 왜: AI 호출 자체가 실패했을 때(전송 오류 등) 도메인에서 명시적으로 실패를 표현해 상위 계층이 대체 경로로 넘어가도록 하기 위함.
 */
public class IntentParseException extends RuntimeException {
    public IntentParseException(String message) {
        super(message);
    }

    public IntentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
