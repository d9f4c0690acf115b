package com.my.jamla.domain.port.in;

/**
 * 사용자가 요청한 즉시 다이제스트.
 */
public interface DigestUseCase {

    /**
     * @return 대기 게시물이 있어 다이제스트 전송을 시도했으면 true, 없어서 안내만 보냈으면 false
     */
    boolean manualDigest(long userId);
}
