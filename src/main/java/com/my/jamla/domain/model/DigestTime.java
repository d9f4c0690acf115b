package com.my.jamla.domain.model;

import com.my.jamla.domain.exception.InvalidRequestException;

import java.time.LocalTime;
import java.util.regex.Pattern;

/**
 * 다이제스트 발송 시각(현지 벽시계 "HH:MM"). 스케줄러는 분 단위 문자열 일치로 비교한다.
 */
public record DigestTime(int hour, int minute) {

    private static final Pattern FORMAT = Pattern.compile("^\\d{2}:\\d{2}$");

    public static final DigestTime DEFAULT = new DigestTime(9, 0);
    public static final DigestTime MIDNIGHT = new DigestTime(0, 0);

    public DigestTime {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new InvalidRequestException("시각 범위가 올바르지 않습니다: " + hour + ":" + minute);
        }
    }

    public static DigestTime parse(String raw) {
        if (raw == null || !FORMAT.matcher(raw.trim()).matches()) {
            throw new InvalidRequestException("시각 형식이 올바르지 않습니다(HH:MM): " + raw);
        }
        String value = raw.trim();
        return new DigestTime(Integer.parseInt(value.substring(0, 2)), Integer.parseInt(value.substring(3, 5)));
    }

    public static DigestTime of(LocalTime time) {
        return new DigestTime(time.getHour(), time.getMinute());
    }

    public String format() {
        return String.format("%02d:%02d", hour, minute);
    }

    @Override
    public String toString() {
        return format();
    }
}
