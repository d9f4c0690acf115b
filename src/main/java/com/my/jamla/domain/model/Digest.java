package com.my.jamla.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 렌더링 전 다이제스트 내용. 채널 순서는 최초 등장 순서를 따른다.
 */
public record Digest(List<Section> sections, List<Long> postIds) {

    public Digest {
        sections = List.copyOf(sections);
        postIds = List.copyOf(postIds);
    }

    public boolean isEmpty() {
        return postIds.isEmpty();
    }

    /**
     * @param totalPosts 채널의 전체 대기 게시물 수
     * @param previews   표시 상한까지 잘린 미리보기 문구
     * @param hiddenPosts 표시되지 않은 나머지 게시물 수
     */
    public record Section(String channelTitle, int totalPosts, List<String> previews, int hiddenPosts) {

        public Section {
            Objects.requireNonNull(channelTitle, "channelTitle");
            previews = List.copyOf(previews);
        }
    }
}
