package com.my.jamla.domain.model;

/**
 * 외부 채널에서 수신한 새 게시물 이벤트.
 */
public record IncomingPost(long externalChannelId, long externalMessageId, String text) {

    public IncomingPost {
        text = text == null ? "" : text;
    }

    public MessageRef messageRef() {
        return new MessageRef(externalChannelId, externalMessageId);
    }
}
