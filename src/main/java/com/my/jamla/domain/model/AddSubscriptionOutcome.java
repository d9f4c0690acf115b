package com.my.jamla.domain.model;

public enum AddSubscriptionOutcome {
    ADDED,
    ALREADY_EXISTS
}
