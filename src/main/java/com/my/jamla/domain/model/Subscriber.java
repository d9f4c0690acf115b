package com.my.jamla.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 봇 사용자. 첫 상호작용 시 생성되며 코어가 삭제하지 않는다.
 */
public record Subscriber(long userId,
                         DeliveryMode mode,
                         DigestTime digestTime,
                         String language,
                         Instant createdAt) {

    public Subscriber {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(digestTime, "digestTime");
        Objects.requireNonNull(language, "language");
    }
}
