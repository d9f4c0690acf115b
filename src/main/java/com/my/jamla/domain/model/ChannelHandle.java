package com.my.jamla.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 채널 핸들. 앞의 '@'를 제거하고 소문자로 정규화한 값만 보관한다.
 */
public record ChannelHandle(String value) {

    private static final Pattern VALID = Pattern.compile("^[a-z0-9_]{1,64}$");

    public ChannelHandle {
        if (value == null || !VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("정규화되지 않은 핸들입니다: " + value);
        }
    }

    public static Optional<ChannelHandle> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        while (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        if (!VALID.matcher(normalized).matches()) {
            return Optional.empty();
        }
        return Optional.of(new ChannelHandle(normalized));
    }

    @Override
    public String toString() {
        return "@" + value;
    }
}
