package com.my.jamla.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 다이제스트 조회/표시/보존 관련 수치 설정.
 */
public record DigestPolicy(Duration lookback,
                           Duration retention,
                           int postsPerChannel,
                           int previewLength,
                           int storedTextLength,
                           DigestTime purgeTime) {

    public DigestPolicy {
        Objects.requireNonNull(lookback, "lookback");
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(purgeTime, "purgeTime");
        if (postsPerChannel < 1 || previewLength < 1 || storedTextLength < 1) {
            throw new IllegalArgumentException("다이제스트 한도는 1 이상이어야 합니다.");
        }
    }

    public static DigestPolicy defaults() {
        return new DigestPolicy(Duration.ofHours(24), Duration.ofDays(7), 5, 100, 500, DigestTime.MIDNIGHT);
    }
}
