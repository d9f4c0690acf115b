package com.my.jamla.domain.port.in;

import com.my.jamla.domain.model.IncomingPost;

/**
 * 외부 채널의 새 게시물을 구독자별 정책에 따라 라우팅한다.
 */
public interface IngestPostUseCase {
    void ingest(IncomingPost post);
}
