package com.my.jamla.domain.model;

/**
 * 전달(forward) 대상 원본 메시지 참조.
 */
public record MessageRef(long externalChannelId, long externalMessageId) {
}
