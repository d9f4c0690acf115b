package com.my.jamla.domain.service;

import com.my.jamla.domain.exception.InvalidRequestException;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.port.in.UserSettingsUseCase;
import com.my.jamla.domain.port.out.SubscriptionStorePort;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public class UserSettingsService implements UserSettingsUseCase {

    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[a-z]{2,8}(-[a-z0-9]{1,8})*$");

    private final SubscriptionStorePort store;

    public UserSettingsService(SubscriptionStorePort store) {
        this.store = store;
    }

    @Override
    public Subscriber getSettings(long userId) {
        return store.getOrCreateUser(userId);
    }

    @Override
    public Subscriber setMode(long userId, DeliveryMode mode) {
        Objects.requireNonNull(mode, "mode");
        store.getOrCreateUser(userId);
        store.updateMode(userId, mode);
        return reload(userId);
    }

    @Override
    public Subscriber setDigestTime(long userId, DigestTime digestTime) {
        Objects.requireNonNull(digestTime, "digestTime");
        store.getOrCreateUser(userId);
        store.updateDigestTime(userId, digestTime);
        return reload(userId);
    }

    @Override
    public Subscriber setLanguage(long userId, String language) {
        String normalized = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        if (!LANGUAGE_TAG.matcher(normalized).matches()) {
            throw new InvalidRequestException("언어 태그 형식이 올바르지 않습니다: " + language);
        }
        store.getOrCreateUser(userId);
        store.updateLanguage(userId, normalized);
        return reload(userId);
    }

    private Subscriber reload(long userId) {
        return store.findUser(userId)
                .orElseThrow(() -> new IllegalStateException("사용자를 다시 읽을 수 없습니다: " + userId));
    }
}
