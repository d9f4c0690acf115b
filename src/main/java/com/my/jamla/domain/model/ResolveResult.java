package com.my.jamla.domain.model;

import java.util.Objects;

/**
 * 채널 해석 결과. 실패는 예외가 아닌 상태 값으로 표현한다.
 */
public record ResolveResult(Status status, ChannelInfo channel, long retryAfterSeconds) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        PRIVATE,
        RATE_LIMITED
    }

    public ResolveResult {
        Objects.requireNonNull(status, "status");
        if (status == Status.FOUND) {
            Objects.requireNonNull(channel, "channel");
        }
    }

    public static ResolveResult found(ChannelInfo channel) {
        return new ResolveResult(Status.FOUND, channel, 0);
    }

    public static ResolveResult notFound() {
        return new ResolveResult(Status.NOT_FOUND, null, 0);
    }

    public static ResolveResult privateChannel() {
        return new ResolveResult(Status.PRIVATE, null, 0);
    }

    public static ResolveResult rateLimited(long retryAfterSeconds) {
        return new ResolveResult(Status.RATE_LIMITED, null, Math.max(0, retryAfterSeconds));
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
