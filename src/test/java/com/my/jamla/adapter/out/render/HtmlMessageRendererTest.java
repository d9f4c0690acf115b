package com.my.jamla.adapter.out.render;

import com.my.jamla.domain.model.Digest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlMessageRendererTest {

    private final HtmlMessageRenderer renderer = new HtmlMessageRenderer();

    @Test
    void rendersDigestSections() {
        Digest digest = new Digest(List.of(
                new Digest.Section("News", 6, List.of("a", "b"), 1),
                new Digest.Section("Sport", 1, List.of("goal"), 0)),
                List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L));

        String text = renderer.digest("en", digest);

        assertThat(text).isEqualTo("""
                📰 <b>Digest for the last 24 hours</b>

                📢 <b>News</b> (6 posts)
                  • a
                  • b
                  <i>+1 more</i>

                📢 <b>Sport</b> (1 posts)
                  • goal""");
    }

    @Test
    void escapesUserProvidedText() {
        Digest digest = new Digest(List.of(new Digest.Section("A&B <news>", 1, List.of("1 < 2"), 0)), List.of(1L));

        String text = renderer.digest("en", digest);

        assertThat(text).contains("<b>A&amp;B &lt;news&gt;</b>", "• 1 &lt; 2");
        assertThat(renderer.newPostHeader("en", "<x>")).isEqualTo("📢 New post from <b>&lt;x&gt;</b>:");
    }

    @Test
    void usesRequestedLanguageAndFallsBackToEnglish() {
        assertThat(renderer.noPosts("ru")).isEqualTo("📭 За последние 24 часа новых постов нет.");
        assertThat(renderer.noPosts("uz")).isEqualTo("📭 Oxirgi 24 soatda yangi postlar yo'q.");
        assertThat(renderer.noPosts("ru-RU")).isEqualTo(renderer.noPosts("ru"));
        assertThat(renderer.noPosts("de")).isEqualTo("📭 No new posts in the last 24 hours.");
        assertThat(renderer.noPosts(null)).isEqualTo(renderer.noPosts("en"));
    }
}
