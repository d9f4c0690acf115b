package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.jamla.domain.model.IncomingPost;

import java.util.Objects;

/**
 * channel-posts 큐의 페이로드. 텍스트가 없는 미디어 게시물은 text가 비어 있을 수 있다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingChannelPost(Long channelId, Long messageId, String text) {

    public IncomingChannelPost {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(messageId, "messageId");
    }

    public IncomingPost toDomain() {
        return new IncomingPost(channelId, messageId, text);
    }
}
