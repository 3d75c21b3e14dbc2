package com.my.timesheet.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 상대 기간("지난주", "최근 N 영업일") 해석을 테스트 가능하게 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();
}
