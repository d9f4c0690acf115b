package com.my.jamla.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * @param rateLimitRetries 전송 계층이 재시도 대기를 지시했을 때 허용하는 재시도 횟수
 * @param interSendDelay   실시간 전달 간 고정 대기
 */
public record DeliveryPolicy(int rateLimitRetries, Duration interSendDelay) {

    public DeliveryPolicy {
        Objects.requireNonNull(interSendDelay, "interSendDelay");
        if (rateLimitRetries < 0) {
            throw new IllegalArgumentException("rateLimitRetries는 음수일 수 없습니다.");
        }
    }

    public static DeliveryPolicy defaults() {
        return new DeliveryPolicy(1, Duration.ofMillis(100));
    }
}
