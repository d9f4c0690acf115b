package com.my.jamla.domain.model;

import java.util.Objects;

public record SubscribeResult(Status status, String title) {

    public enum Status {
        ADDED,
        ALREADY_ADDED,
        NOT_FOUND
    }

    public SubscribeResult {
        Objects.requireNonNull(status, "status");
    }

    public static SubscribeResult added(String title) {
        return new SubscribeResult(Status.ADDED, title);
    }

    public static SubscribeResult alreadyAdded() {
        return new SubscribeResult(Status.ALREADY_ADDED, null);
    }

    public static SubscribeResult notFound() {
        return new SubscribeResult(Status.NOT_FOUND, null);
    }
}
