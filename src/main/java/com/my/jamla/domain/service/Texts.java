package com.my.jamla.domain.service;

final class Texts {

    private Texts() {
    }

    /**
     * 최대 길이까지 자른다. 서로게이트 쌍은 쪼개지 않는다.
     */
    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
