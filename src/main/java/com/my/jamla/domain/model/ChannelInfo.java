package com.my.jamla.domain.model;

import java.util.Objects;

/**
 * 전송 계층이 핸들을 해석한 결과.
 */
public record ChannelInfo(ChannelHandle handle, long externalId, String title) {

    public ChannelInfo {
        Objects.requireNonNull(handle, "handle");
        title = title == null ? handle.value() : title;
    }
}
