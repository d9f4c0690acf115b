package com.my.jamla.config;

import com.my.jamla.adapter.out.clock.OffsetClockAdapter;
import com.my.jamla.adapter.out.clock.ThreadSleeperAdapter;
import com.my.jamla.domain.model.DeliveryPolicy;
import com.my.jamla.domain.model.DigestPolicy;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.port.out.ChannelTransportPort;
import com.my.jamla.domain.port.out.ClockPort;
import com.my.jamla.domain.port.out.MessageRenderPort;
import com.my.jamla.domain.port.out.SleeperPort;
import com.my.jamla.domain.port.out.SubscriptionStorePort;
import com.my.jamla.domain.service.ChannelWatchService;
import com.my.jamla.domain.service.DigestComposer;
import com.my.jamla.domain.service.DigestService;
import com.my.jamla.domain.service.NotificationSender;
import com.my.jamla.domain.service.UserSettingsService;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * 라우터/다이제스트 서비스는 유스케이스 인터페이스가 아닌 구체 타입으로 노출해 어댑터가 하나의 인스턴스를 공유한다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @Singleton
    public DigestPolicy digestPolicy(AppConfig appConfig) {
        AppConfig.DigestConfig digest = appConfig.digest();
        return new DigestPolicy(
                Duration.ofHours(digest.lookbackHours()),
                Duration.ofDays(digest.retentionDays()),
                digest.postsPerChannel(),
                digest.previewLength(),
                digest.storedTextLength(),
                DigestTime.parse(digest.purgeTime()));
    }

    @Produces
    @Singleton
    public DeliveryPolicy deliveryPolicy(AppConfig appConfig) {
        return new DeliveryPolicy(
                appConfig.delivery().rateLimitRetries(),
                Duration.ofMillis(appConfig.delivery().interSendDelayMs()));
    }

    @Produces
    @ApplicationScoped
    public NotificationSender notificationSender(ChannelTransportPort transport,
                                                 SleeperPort sleeper,
                                                 DeliveryPolicy deliveryPolicy) {
        return new NotificationSender(transport, sleeper, deliveryPolicy);
    }

    /**
     * 감시 집합을 복원한 뒤에만 인스턴스를 내보낸다. 메시징 소비자보다 먼저 준비되도록 기동 시 생성한다.
     */
    @Produces
    @Startup
    @ApplicationScoped
    public ChannelWatchService channelWatchService(SubscriptionStorePort store,
                                                   ChannelTransportPort transport,
                                                   NotificationSender notificationSender,
                                                   MessageRenderPort renderer,
                                                   SleeperPort sleeper,
                                                   DigestPolicy digestPolicy) {
        ChannelWatchService service = new ChannelWatchService(store, transport, notificationSender, renderer, sleeper,
                digestPolicy.storedTextLength());
        service.restoreWatchSet();
        return service;
    }

    @Produces
    @ApplicationScoped
    public DigestService digestService(SubscriptionStorePort store,
                                       NotificationSender notificationSender,
                                       MessageRenderPort renderer,
                                       ClockPort clockPort,
                                       DigestPolicy digestPolicy) {
        return new DigestService(store, new DigestComposer(digestPolicy), notificationSender, renderer,
                clockPort, digestPolicy);
    }

    @Produces
    @ApplicationScoped
    public UserSettingsService userSettingsService(SubscriptionStorePort store) {
        return new UserSettingsService(store);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(ZoneId.of(appConfig.digest().zone()));
    }

    @Produces
    @ApplicationScoped
    public SleeperPort sleeperPort() {
        return new ThreadSleeperAdapter();
    }
}
