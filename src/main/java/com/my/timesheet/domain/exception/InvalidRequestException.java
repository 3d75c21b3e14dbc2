package com.my.timesheet.domain.exception;

/**
 * 왜: 계획 요청 메시지가 필수 필드/action/prompt 길이 계약을 어겼을 때 파이프라인에 들어가기 전에 거르기 위함.
 *
 * <p>계획 내용의 오류는 예외가 아니라 PlanIssue로 돌려준다.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
