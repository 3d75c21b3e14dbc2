package com.my.timesheet.domain.model;

/**
 * 왜: 타임시트 소유자(기술자)와 연결된 사용자 계정을 함께 표현하기 위함. userId가 없을 수 있다.
 */
public record Technician(long id, Long userId, String email) {
}
