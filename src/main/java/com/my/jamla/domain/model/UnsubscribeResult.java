package com.my.jamla.domain.model;

import java.util.Objects;

public record UnsubscribeResult(Status status, String title) {

    public enum Status {
        REMOVED,
        NOT_FOUND
    }

    public UnsubscribeResult {
        Objects.requireNonNull(status, "status");
    }

    public static UnsubscribeResult removed(String title) {
        return new UnsubscribeResult(Status.REMOVED, title);
    }

    public static UnsubscribeResult notFound() {
        return new UnsubscribeResult(Status.NOT_FOUND, null);
    }
}
