package com.my.jamla.domain.service;

import com.my.jamla.domain.model.Digest;
import com.my.jamla.domain.model.DigestPolicy;
import com.my.jamla.domain.model.PendingPost;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 대기 게시물을 채널별로 묶어 다이제스트 내용을 만든다.
 * 입력 순서(최신순)를 유지하고, 채널 순서는 처음 등장한 순서를 따른다.
 */
public class DigestComposer {

    static final String ELLIPSIS = "...";

    private final DigestPolicy policy;

    public DigestComposer(DigestPolicy policy) {
        this.policy = policy;
    }

    public Digest compose(List<PendingPost> posts) {
        Map<Long, List<PendingPost>> byChannel = new LinkedHashMap<>();
        List<Long> postIds = new ArrayList<>(posts.size());
        for (PendingPost post : posts) {
            byChannel.computeIfAbsent(post.channelId(), key -> new ArrayList<>()).add(post);
            postIds.add(post.id());
        }

        List<Digest.Section> sections = new ArrayList<>(byChannel.size());
        for (List<PendingPost> group : byChannel.values()) {
            List<String> previews = new ArrayList<>();
            for (PendingPost post : group.subList(0, Math.min(group.size(), policy.postsPerChannel()))) {
                String preview = preview(post.text());
                // 미디어만 있는 게시물은 개수에만 포함된다
                if (!preview.isBlank()) {
                    previews.add(preview);
                }
            }
            int hidden = Math.max(0, group.size() - policy.postsPerChannel());
            sections.add(new Digest.Section(group.get(0).channelTitle(), group.size(), previews, hidden));
        }
        return new Digest(sections, postIds);
    }

    String preview(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= policy.previewLength()) {
            return text;
        }
        return Texts.truncate(text, policy.previewLength()) + ELLIPSIS;
    }
}
