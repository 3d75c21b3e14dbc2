package com.my.timesheet.domain.model;

/**
 * 왜: 휴식 구간처럼 프로젝트 없이 시작/종료만 갖는 시간대를 표현하기 위함.
 */
public record TimeSlot(String startTime, String endTime) {
}
