package com.my.jamla.support;

import com.my.jamla.domain.port.out.ClockPort;

import java.time.Duration;
import java.time.OffsetDateTime;

public class MutableClock implements ClockPort {

    private OffsetDateTime now;

    public MutableClock(OffsetDateTime now) {
        this.now = now;
    }

    public static MutableClock at(String isoOffsetDateTime) {
        return new MutableClock(OffsetDateTime.parse(isoOffsetDateTime));
    }

    @Override
    public synchronized OffsetDateTime now() {
        return now;
    }

    public synchronized void set(OffsetDateTime now) {
        this.now = now;
    }

    public synchronized void advance(Duration duration) {
        this.now = now.plus(duration);
    }
}
