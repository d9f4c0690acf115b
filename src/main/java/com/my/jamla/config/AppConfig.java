package com.my.jamla.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    StoreConfig store();

    DigestConfig digest();

    DeliveryConfig delivery();

    UsersConfig users();

    TelegramConfig telegram();

    interface StoreConfig {
        @WithName("sqlite-path")
        @WithDefault("./data/jamla.db")
        String sqlitePath();

        @WithName("busy-timeout-ms")
        @WithDefault("5000")
        int busyTimeoutMs();
    }

    interface DigestConfig {
        @WithName("zone")
        @WithDefault("Asia/Tashkent")
        String zone();

        @WithName("lookback-hours")
        @WithDefault("24")
        int lookbackHours();

        @WithName("retention-days")
        @WithDefault("7")
        int retentionDays();

        @WithName("tick-seconds")
        @WithDefault("60")
        int tickSeconds();

        @WithName("posts-per-channel")
        @WithDefault("5")
        int postsPerChannel();

        @WithName("preview-length")
        @WithDefault("100")
        int previewLength();

        @WithName("stored-text-length")
        @WithDefault("500")
        int storedTextLength();

        @WithName("purge-time")
        @WithDefault("00:00")
        String purgeTime();
    }

    interface DeliveryConfig {
        @WithName("rate-limit-retries")
        @WithDefault("1")
        int rateLimitRetries();

        @WithName("inter-send-delay-ms")
        @WithDefault("100")
        long interSendDelayMs();
    }

    interface UsersConfig {
        @WithName("default-language")
        @WithDefault("uz")
        String defaultLanguage();
    }

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("api-base-url")
        @WithDefault("https://api.telegram.org")
        String apiBaseUrl();

        @WithName("request-timeout-seconds")
        @WithDefault("10")
        int requestTimeoutSeconds();
    }
}
