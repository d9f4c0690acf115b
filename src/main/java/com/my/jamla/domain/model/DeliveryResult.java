package com.my.jamla.domain.model;

import java.util.Objects;

/**
 * 수신자 한 명에 대한 전송 결과.
 */
public record DeliveryResult(Status status, long retryAfterSeconds, String reason) {

    public enum Status {
        OK,
        RATE_LIMITED,
        FAILED
    }

    private static final DeliveryResult OK_RESULT = new DeliveryResult(Status.OK, 0, null);

    public DeliveryResult {
        Objects.requireNonNull(status, "status");
    }

    public static DeliveryResult ok() {
        return OK_RESULT;
    }

    public static DeliveryResult rateLimited(long retryAfterSeconds) {
        return new DeliveryResult(Status.RATE_LIMITED, Math.max(0, retryAfterSeconds), "rate limited");
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(Status.FAILED, 0, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
