package com.my.jamla.adapter.out.render;

import com.my.jamla.domain.model.Digest;
import com.my.jamla.domain.port.out.MessageRenderPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Locale;
import java.util.Map;

/**
 * 텔레그램 HTML parse mode용 문구를 만든다. 모르는 언어는 영어로 대체한다.
 */
@ApplicationScoped
public class HtmlMessageRenderer implements MessageRenderPort {

    static final String FALLBACK_LANGUAGE = "en";

    private static final Map<String, Phrases> PHRASES = Map.of(
            "en", new Phrases(
                    "📰 <b>Digest for the last 24 hours</b>",
                    "%d posts",
                    "+%d more",
                    "📢 New post from <b>%s</b>:",
                    "📭 No new posts in the last 24 hours."),
            "uz", new Phrases(
                    "📰 <b>Oxirgi 24 soat xulosasi</b>",
                    "%d ta post",
                    "+%d ta yana",
                    "📢 <b>%s</b> dan yangi post:",
                    "📭 Oxirgi 24 soatda yangi postlar yo'q."),
            "ru", new Phrases(
                    "📰 <b>Сводка за 24 часа</b>",
                    "постов: %d",
                    "+ещё %d",
                    "📢 Новый пост от <b>%s</b>:",
                    "📭 За последние 24 часа новых постов нет.")
    );

    @Override
    public String newPostHeader(String language, String channelTitle) {
        return String.format(phrases(language).newPost(), escape(channelTitle));
    }

    @Override
    public String digest(String language, Digest digest) {
        Phrases phrases = phrases(language);
        StringBuilder message = new StringBuilder(phrases.digestHeader()).append("\n\n");
        for (Digest.Section section : digest.sections()) {
            message.append("📢 <b>").append(escape(section.channelTitle())).append("</b> (")
                    .append(String.format(phrases.sectionCount(), section.totalPosts())).append(")\n");
            for (String preview : section.previews()) {
                message.append("  • ").append(escape(preview)).append('\n');
            }
            if (section.hiddenPosts() > 0) {
                message.append("  <i>").append(String.format(phrases.more(), section.hiddenPosts())).append("</i>\n");
            }
            message.append('\n');
        }
        return message.toString().stripTrailing();
    }

    @Override
    public String noPosts(String language) {
        return phrases(language).noPosts();
    }

    private Phrases phrases(String language) {
        if (language == null) {
            return PHRASES.get(FALLBACK_LANGUAGE);
        }
        String primary = language.toLowerCase(Locale.ROOT).split("-", 2)[0];
        return PHRASES.getOrDefault(primary, PHRASES.get(FALLBACK_LANGUAGE));
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private record Phrases(String digestHeader, String sectionCount, String more, String newPost, String noPosts) {
    }
}
