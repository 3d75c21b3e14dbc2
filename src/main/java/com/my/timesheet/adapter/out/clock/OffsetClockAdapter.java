package com.my.timesheet.adapter.out.clock;

import com.my.timesheet.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 테스트와 시간대 변환 일관성을 확보하기 위함.
 *
 * <p>UTC 기준으로 돌려주고, 테넌트 시간대 변환은 사용하는 쪽에서 한다.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(Clock.systemUTC());
    }

    public static OffsetClockAdapter of(Clock clock) {
        return new OffsetClockAdapter(clock);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
