package com.my.jamla.config;

import com.my.jamla.domain.exception.InvalidRequestException;
import com.my.jamla.domain.model.DigestTime;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.LaunchMode;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("TELEGRAM_BOT_TOKEN", appConfig.telegram().botToken().orElse(null), isProd);
        validateZone(appConfig.digest().zone());
        validatePurgeTime(appConfig.digest().purgeTime());
        validatePositive("app.digest.tick-seconds", appConfig.digest().tickSeconds());
        validatePositive("app.digest.posts-per-channel", appConfig.digest().postsPerChannel());
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("시간대 설정이 올바르지 않습니다: " + zone, e);
        }
    }

    private void validatePurgeTime(String purgeTime) {
        try {
            DigestTime.parse(purgeTime);
        } catch (InvalidRequestException e) {
            throw new IllegalStateException("정리 시각 설정이 올바르지 않습니다: " + purgeTime, e);
        }
    }

    private void validatePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException("설정 값은 1 이상이어야 합니다: " + name + "=" + value);
        }
    }
}
