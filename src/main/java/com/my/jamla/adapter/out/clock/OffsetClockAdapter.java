package com.my.jamla.adapter.out.clock;

import com.my.jamla.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 다이제스트 시각 비교에 쓰이는 현지 벽시계. 시간대는 설정에서 받는다.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter of(ZoneId zoneId) {
        return new OffsetClockAdapter(zoneId);
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(ZoneId.systemDefault());
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
