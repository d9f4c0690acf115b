package com.my.jamla.domain.port.out;

import com.my.jamla.domain.model.Digest;

/**
 * 코어가 고른 내용을 사용자 언어의 문구로 바꾼다.
 */
public interface MessageRenderPort {

    String newPostHeader(String language, String channelTitle);

    String digest(String language, Digest digest);

    String noPosts(String language);
}
