package com.my.jamla.domain.service;

import com.my.jamla.domain.model.AddSubscriptionOutcome;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.ChannelInfo;
import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.IncomingPost;
import com.my.jamla.domain.model.PostRecordOutcome;
import com.my.jamla.domain.model.RemoveSubscriptionOutcome;
import com.my.jamla.domain.model.ResolveResult;
import com.my.jamla.domain.model.SubscribeResult;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.model.UnsubscribeResult;
import com.my.jamla.domain.port.in.IngestPostUseCase;
import com.my.jamla.domain.port.in.SubscriptionUseCase;
import com.my.jamla.domain.port.out.ChannelTransportPort;
import com.my.jamla.domain.port.out.MessageRenderPort;
import com.my.jamla.domain.port.out.SleeperPort;
import com.my.jamla.domain.port.out.SubscriptionStorePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 구독 관리와 게시물 라우팅을 담당한다.
 * <p>
 * 감시 집합은 저장소의 "구독자가 1명 이상인 채널" 목록을 외부 채널 ID로 비춘 캐시다.
 * 시작 시 저장소에서 다시 만들고, 구독 변경과 같은 흐름에서 락을 잡고 갱신한다.
 * 마지막 구독자 확인과 제거는 같은 락 안에서 수행해 동시 구독이 유실되지 않게 한다.
 */
public class ChannelWatchService implements SubscriptionUseCase, IngestPostUseCase {

    private static final Logger log = Logger.getLogger(ChannelWatchService.class);

    private final SubscriptionStorePort store;
    private final ChannelTransportPort transport;
    private final NotificationSender notificationSender;
    private final MessageRenderPort renderer;
    private final SleeperPort sleeper;
    private final int storedTextLength;

    private final Set<Long> watching = new HashSet<>();
    private final ReentrantLock watchLock = new ReentrantLock();

    public ChannelWatchService(SubscriptionStorePort store,
                               ChannelTransportPort transport,
                               NotificationSender notificationSender,
                               MessageRenderPort renderer,
                               SleeperPort sleeper,
                               int storedTextLength) {
        this.store = store;
        this.transport = transport;
        this.notificationSender = notificationSender;
        this.renderer = renderer;
        this.sleeper = sleeper;
        this.storedTextLength = storedTextLength;
    }

    /**
     * 저장소 스냅샷으로 감시 집합을 다시 만든다. 스냅샷도 락 안에서 읽어 그 사이의 구독 변경이 덮어써지지 않게 한다.
     */
    public int restoreWatchSet() {
        int size;
        watchLock.lock();
        try {
            List<Channel> channels = store.listWatchedChannels();
            watching.clear();
            for (Channel channel : channels) {
                watching.add(channel.externalId());
            }
            size = watching.size();
        } finally {
            watchLock.unlock();
        }
        log.infof("감시 채널 %d개를 복원했습니다.", size);
        return size;
    }

    public boolean isWatching(long externalChannelId) {
        watchLock.lock();
        try {
            return watching.contains(externalChannelId);
        } finally {
            watchLock.unlock();
        }
    }

    public Set<Long> watchedChannelIds() {
        watchLock.lock();
        try {
            return Set.copyOf(watching);
        } finally {
            watchLock.unlock();
        }
    }

    @Override
    public SubscribeResult subscribe(long userId, String rawHandle) {
        store.getOrCreateUser(userId);
        Optional<ChannelHandle> parsed = ChannelHandle.parse(rawHandle);
        if (parsed.isEmpty()) {
            log.infof("채널 핸들 형식이 올바르지 않습니다 user=%d handle=%s", userId, rawHandle);
            return SubscribeResult.notFound();
        }
        ChannelHandle handle = parsed.get();

        Optional<Channel> known = store.findChannelByHandle(handle);
        if (known.isPresent() && store.hasSubscription(userId, known.get().id())) {
            return SubscribeResult.alreadyAdded();
        }

        ResolveResult resolved = resolveWithBackoff(handle);
        if (!resolved.isFound()) {
            log.infof("채널을 구독할 수 없습니다 (%s): %s", resolved.status(), handle);
            return SubscribeResult.notFound();
        }

        ChannelInfo info = resolved.channel();
        Channel channel = store.resolveOrCreateChannel(handle, info.externalId(), info.title());
        if (store.addSubscription(userId, channel.id()) == AddSubscriptionOutcome.ALREADY_EXISTS) {
            return SubscribeResult.alreadyAdded();
        }
        activate(channel.externalId());
        log.infof("사용자 %d 구독 추가: %s", userId, handle);
        return SubscribeResult.added(channel.title());
    }

    @Override
    public UnsubscribeResult unsubscribe(long userId, String rawHandle) {
        Optional<Channel> channel = ChannelHandle.parse(rawHandle).flatMap(store::findChannelByHandle);
        if (channel.isEmpty()) {
            return UnsubscribeResult.notFound();
        }
        if (store.removeSubscription(userId, channel.get().id()) == RemoveSubscriptionOutcome.NOT_FOUND) {
            return UnsubscribeResult.notFound();
        }
        deactivateIfUnwatched(channel.get());
        log.infof("사용자 %d 구독 해제: %s", userId, channel.get().handle());
        return UnsubscribeResult.removed(channel.get().title());
    }

    @Override
    public List<Channel> listSubscriptions(long userId) {
        return store.listSubscriptions(userId);
    }

    @Override
    public void ingest(IncomingPost post) {
        if (!isWatching(post.externalChannelId())) {
            log.debugf("감시하지 않는 채널의 게시물을 무시합니다: %d", post.externalChannelId());
            return;
        }
        Optional<Channel> found = store.findChannelByExternalId(post.externalChannelId());
        if (found.isEmpty()) {
            return;
        }
        Channel channel = found.get();
        List<Subscriber> subscribers = store.listSubscribers(channel.id());

        boolean stored = false;
        int forwarded = 0;
        for (Subscriber subscriber : subscribers) {
            switch (subscriber.mode()) {
                case OFF -> {
                }
                case REALTIME -> {
                    if (deliverRealtime(subscriber, channel, post)) {
                        forwarded++;
                    }
                }
                case DIGEST -> {
                    if (!stored) {
                        storeForDigest(channel, post);
                        stored = true;
                    }
                }
            }
        }
        log.debugf("게시물 라우팅 완료 channel=%d message=%d subscribers=%d forwarded=%d",
                post.externalChannelId(), post.externalMessageId(), subscribers.size(), forwarded);
    }

    private boolean deliverRealtime(Subscriber subscriber, Channel channel, IncomingPost post) {
        try {
            String header = renderer.newPostHeader(subscriber.language(), channel.title());
            DeliveryResult result = notificationSender.deliverRealtime(subscriber.userId(), header, post.messageRef());
            return result.isOk();
        } catch (RuntimeException e) {
            log.warnf("실시간 전달 실패 user=%d: %s", subscriber.userId(), e.getMessage());
            return false;
        }
    }

    private void storeForDigest(Channel channel, IncomingPost post) {
        String text = Texts.truncate(post.text(), storedTextLength);
        PostRecordOutcome outcome = store.recordPost(channel.id(), post.externalMessageId(), text);
        if (outcome == PostRecordOutcome.DUPLICATE_IGNORED) {
            log.debugf("이미 저장된 게시물입니다 channel=%d message=%d", channel.id(), post.externalMessageId());
        }
    }

    private ResolveResult resolveWithBackoff(ChannelHandle handle) {
        ResolveResult result = transport.resolveChannel(handle);
        if (result.status() != ResolveResult.Status.RATE_LIMITED) {
            return result;
        }
        log.warnf("채널 조회 레이트 리밋: %d초 후 한 번 재시도합니다 %s", result.retryAfterSeconds(), handle);
        try {
            sleeper.sleep(Duration.ofSeconds(result.retryAfterSeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return result;
        }
        return transport.resolveChannel(handle);
    }

    private void activate(long externalChannelId) {
        watchLock.lock();
        try {
            if (watching.add(externalChannelId)) {
                log.debugf("채널 감시 시작: %d", externalChannelId);
            }
        } finally {
            watchLock.unlock();
        }
    }

    private void deactivateIfUnwatched(Channel channel) {
        watchLock.lock();
        try {
            if (store.countSubscribers(channel.id()) == 0 && watching.remove(channel.externalId())) {
                log.debugf("채널 감시 중단: %d", channel.externalId());
            }
        } finally {
            watchLock.unlock();
        }
    }
}
