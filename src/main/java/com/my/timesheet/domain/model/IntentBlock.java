package com.my.timesheet.domain.model;

/**
 * 왜: 의도에 포함된 근무/휴식 시간 블록을 검증 전 원문 그대로 전달하기 위함.
 */
public record IntentBlock(String from, String to) {
}
