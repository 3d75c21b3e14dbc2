package com.my.timesheet.domain.service.text;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 계획의 "H:mm"과 저장된 기존 항목의 여러 시간 표기를 모두 "자정 이후 분"으로 환산하기 위함.
 */
public final class TimeOfDay {

    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern CLOCK_SECONDS = Pattern.compile("^(\\d{1,2}):(\\d{2}):(\\d{2})$");
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd H:mm"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd H:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private TimeOfDay() {
    }

    /**
     * 엄격한 H:mm(0~23시, 0~59분)만 허용한다.
     */
    public static boolean isValidClock(String value) {
        return clockMinutes(value).isPresent();
    }

    public static Optional<Integer> clockMinutes(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = CLOCK.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return minutes(matcher.group(1), matcher.group(2));
    }

    /**
     * H:mm, H:mm:ss, 날짜가 붙은 표기까지 허용한다. 초는 버린다.
     */
    public static Optional<Integer> toMinutes(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        Optional<Integer> clock = clockMinutes(trimmed);
        if (clock.isPresent()) {
            return clock;
        }
        Matcher seconds = CLOCK_SECONDS.matcher(trimmed);
        if (seconds.matches()) {
            int secondValue = Integer.parseInt(seconds.group(3));
            if (secondValue > 59) {
                return Optional.empty();
            }
            return minutes(seconds.group(1), seconds.group(2));
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                LocalTime time = LocalDateTime.parse(trimmed, format).toLocalTime();
                return Optional.of(time.getHour() * 60 + time.getMinute());
            } catch (DateTimeParseException e) {
                // 다음 형식 시도
            }
        }
        return Optional.empty();
    }

    public static String format(int minutes) {
        return String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
    }

    private static Optional<Integer> minutes(String hours, String minutes) {
        int h = Integer.parseInt(hours);
        int m = Integer.parseInt(minutes);
        if (h > 23 || m > 59) {
            return Optional.empty();
        }
        return Optional.of(h * 60 + m);
    }
}
