package com.my.jamla.domain.model;

import com.my.jamla.domain.exception.InvalidRequestException;

import java.util.Locale;

/**
 * 구독자별 전달 방식. 저장소에는 소문자 코드로 기록된다.
 */
public enum DeliveryMode {
    REALTIME("realtime"),
    DIGEST("digest"),
    OFF("off");

    private final String code;

    DeliveryMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static DeliveryMode fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException("전달 모드가 비어 있습니다.");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DeliveryMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidRequestException("알 수 없는 전달 모드입니다: " + raw);
    }
}
