package com.my.jamla.domain.port.out;

import com.my.jamla.domain.model.AddSubscriptionOutcome;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.PendingPost;
import com.my.jamla.domain.model.PostRecordOutcome;
import com.my.jamla.domain.model.RemoveSubscriptionOutcome;
import com.my.jamla.domain.model.Subscriber;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 사용자, 채널, 구독, 대기 게시물의 유일한 원천.
 * 각 연산은 자신의 전제 조건 검사와 함께 원자적으로 수행되며 중복 키는 결과 값으로 보고된다.
 * 저장소 장애는 {@link com.my.jamla.domain.exception.StoreUnavailableException}으로 전파된다.
 */
public interface SubscriptionStorePort {

    Subscriber getOrCreateUser(long userId);

    Optional<Subscriber> findUser(long userId);

    void updateMode(long userId, DeliveryMode mode);

    void updateDigestTime(long userId, DigestTime digestTime);

    void updateLanguage(long userId, String language);

    List<Subscriber> findDigestUsersAt(DigestTime digestTime);

    Channel resolveOrCreateChannel(ChannelHandle handle, long externalId, String title);

    Optional<Channel> findChannelByHandle(ChannelHandle handle);

    Optional<Channel> findChannelByExternalId(long externalId);

    boolean hasSubscription(long userId, long channelId);

    AddSubscriptionOutcome addSubscription(long userId, long channelId);

    RemoveSubscriptionOutcome removeSubscription(long userId, long channelId);

    int countSubscribers(long channelId);

    List<Channel> listWatchedChannels();

    List<Subscriber> listSubscribers(long channelId);

    List<Channel> listSubscriptions(long userId);

    PostRecordOutcome recordPost(long channelId, long externalMessageId, String text);

    /**
     * 조회 시점 기준 lookback 이내에 생성된 미발송 게시물을 최신순으로 반환한다.
     */
    List<PendingPost> unsentPostsForUser(long userId, Duration lookback);

    void markSent(Collection<Long> postIds);

    int purgeOlderThan(Duration retention);
}
