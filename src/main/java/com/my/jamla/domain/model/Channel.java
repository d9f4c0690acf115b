package com.my.jamla.domain.model;

import java.util.Objects;

public record Channel(long id, long externalId, ChannelHandle handle, String title) {

    public Channel {
        Objects.requireNonNull(handle, "handle");
        title = title == null ? "" : title;
    }
}
