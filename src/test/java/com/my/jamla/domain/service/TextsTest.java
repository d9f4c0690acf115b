package com.my.jamla.domain.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextsTest {

    @Test
    void truncatesWithoutSplittingSurrogatePairs() {
        String withEmoji = "ab📰cd";

        assertThat(Texts.truncate(withEmoji, 3)).isEqualTo("ab");
        assertThat(Texts.truncate(withEmoji, 4)).isEqualTo("ab📰");
        assertThat(Texts.truncate("short", 10)).isEqualTo("short");
        assertThat(Texts.truncate(null, 10)).isEmpty();
    }
}
