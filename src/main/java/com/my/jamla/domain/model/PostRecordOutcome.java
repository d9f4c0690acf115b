package com.my.jamla.domain.model;

public enum PostRecordOutcome {
    RECORDED,
    DUPLICATE_IGNORED
}
