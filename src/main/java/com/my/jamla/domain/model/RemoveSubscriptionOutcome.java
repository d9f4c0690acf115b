package com.my.jamla.domain.model;

public enum RemoveSubscriptionOutcome {
    REMOVED,
    NOT_FOUND
}
