package com.my.timesheet.domain.model;

import java.util.Locale;

/**
 * 왜: 저장된 타임시트 상태 문자열을 한 곳에서 해석해 잠금 판단 기준을 흩어지지 않게 하기 위함.
 */
public enum TimesheetStatus {
    DRAFT("draft"),
    SUBMITTED("submitted"),
    APPROVED("approved"),
    REJECTED("rejected"),
    CLOSED("closed");

    private final String value;

    TimesheetStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * approved/closed 상태는 해당 일자 전체를 잠근다.
     */
    public static boolean locksDate(String status) {
        if (status == null) {
            return false;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        return APPROVED.value.equals(normalized) || CLOSED.value.equals(normalized);
    }
}
