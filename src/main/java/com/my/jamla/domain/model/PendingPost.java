package com.my.jamla.domain.model;

import java.time.Instant;

/**
 * 다이제스트 대기 게시물. 표시용으로 소속 채널의 제목과 핸들을 함께 싣는다.
 */
public record PendingPost(long id,
                          long channelId,
                          String channelTitle,
                          ChannelHandle channelHandle,
                          long externalMessageId,
                          String text,
                          Instant createdAt) {
}
