package com.my.jamla.domain.port.in;

import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.Subscriber;

public interface UserSettingsUseCase {

    Subscriber getSettings(long userId);

    Subscriber setMode(long userId, DeliveryMode mode);

    Subscriber setDigestTime(long userId, DigestTime digestTime);

    Subscriber setLanguage(long userId, String language);
}
