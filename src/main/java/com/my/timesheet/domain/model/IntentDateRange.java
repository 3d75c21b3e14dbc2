package com.my.timesheet.domain.model;

import java.util.Locale;

/**
 * 왜: AI가 돌려준 기간 표현(절대/상대)을 해석 전 형태 그대로 보존하기 위함.
 *
 * <p>absolute는 from/to, relative는 value(this_week, last_week, next_week, last_n_workdays)와 count를 사용한다.
 */
public record IntentDateRange(String type, String from, String to, String value, Integer count) {

    public static final String ABSOLUTE = "absolute";
    public static final String RELATIVE = "relative";
    public static final String LAST_N_WORKDAYS = "last_n_workdays";

    public static IntentDateRange absolute(String from, String to) {
        return new IntentDateRange(ABSOLUTE, from, to, null, null);
    }

    public static IntentDateRange relative(String value, Integer count) {
        return new IntentDateRange(RELATIVE, null, null, value, count);
    }

    public String normalizedType() {
        return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }

    public String normalizedValue() {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
