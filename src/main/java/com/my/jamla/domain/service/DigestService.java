package com.my.jamla.domain.service;

import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.Digest;
import com.my.jamla.domain.model.DigestPolicy;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.PendingPost;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.port.in.DigestUseCase;
import com.my.jamla.domain.port.out.ClockPort;
import com.my.jamla.domain.port.out.MessageRenderPort;
import com.my.jamla.domain.port.out.SubscriptionStorePort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 예약/수동 다이제스트 발송과 보존 기간 정리를 수행한다.
 * <p>
 * 예약 경로는 대기 게시물이 없으면 아무것도 보내지 않고, 수동 경로는 "게시물 없음" 안내를 보낸다.
 * 전송 성공 후 발송 표시가 중단되면 다음 실행에서 같은 게시물이 다시 나갈 수 있다.
 */
public class DigestService implements DigestUseCase {

    private static final Logger log = Logger.getLogger(DigestService.class);

    // Telegram sendMessage 본문 한도 (UTF-16 code unit 기준)
    static final int MESSAGE_LIMIT = 4096;

    public enum Outcome {
        DELIVERED,
        EMPTY,
        FAILED
    }

    public record TickSummary(DigestTime time, int dueUsers, int delivered, int failed, int purged) {
    }

    private final SubscriptionStorePort store;
    private final DigestComposer composer;
    private final NotificationSender notificationSender;
    private final MessageRenderPort renderer;
    private final ClockPort clockPort;
    private final DigestPolicy policy;

    public DigestService(SubscriptionStorePort store,
                         DigestComposer composer,
                         NotificationSender notificationSender,
                         MessageRenderPort renderer,
                         ClockPort clockPort,
                         DigestPolicy policy) {
        this.store = store;
        this.composer = composer;
        this.notificationSender = notificationSender;
        this.renderer = renderer;
        this.clockPort = clockPort;
        this.policy = policy;
    }

    public TickSummary tick() {
        return runTick(clockPort.now());
    }

    public TickSummary runTick(OffsetDateTime now) {
        DigestTime current = DigestTime.of(now.toLocalTime());
        List<Subscriber> due = store.findDigestUsersAt(current);
        int delivered = 0;
        int failed = 0;
        for (Subscriber user : due) {
            MDC.put("userId", String.valueOf(user.userId()));
            try {
                Outcome outcome = deliverDigest(user);
                if (outcome == Outcome.DELIVERED) {
                    delivered++;
                } else if (outcome == Outcome.FAILED) {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.errorf(e, "다이제스트 처리 중 오류 user=%d", user.userId());
            } finally {
                MDC.remove("userId");
            }
        }

        int purged = 0;
        if (current.equals(policy.purgeTime())) {
            purged = store.purgeOlderThan(policy.retention());
            log.infof("보존 기간이 지난 게시물 %d건을 삭제했습니다.", purged);
        }
        if (!due.isEmpty()) {
            log.infof("다이제스트 틱 %s: 대상 %d명, 전송 %d, 실패 %d", current, due.size(), delivered, failed);
        }
        return new TickSummary(current, due.size(), delivered, failed, purged);
    }

    public Outcome deliverDigest(Subscriber user) {
        List<PendingPost> posts = store.unsentPostsForUser(user.userId(), policy.lookback());
        if (posts.isEmpty()) {
            return Outcome.EMPTY;
        }
        return send(user, posts);
    }

    @Override
    public boolean manualDigest(long userId) {
        Subscriber user = store.getOrCreateUser(userId);
        List<PendingPost> posts = store.unsentPostsForUser(userId, policy.lookback());
        if (posts.isEmpty()) {
            notificationSender.notify(userId, renderer.noPosts(user.language()));
            return false;
        }
        send(user, posts);
        return true;
    }

    private Outcome send(Subscriber user, List<PendingPost> posts) {
        Digest digest = composer.compose(posts);
        String text = renderer.digest(user.language(), digest);
        if (exceedsMessageLimit(text)) {
            log.warnf("다이제스트가 메시지 한도를 넘습니다 user=%d length=%d limit=%d channels=%d",
                    user.userId(), text.length(), MESSAGE_LIMIT, digest.sections().size());
        }
        DeliveryResult result = notificationSender.notify(user.userId(), text);
        if (!result.isOk()) {
            log.warnf("다이제스트 전송 실패 user=%d status=%s", user.userId(), result.status());
            return Outcome.FAILED;
        }
        store.markSent(digest.postIds());
        log.infof("다이제스트 전송 user=%d posts=%d", user.userId(), posts.size());
        return Outcome.DELIVERED;
    }

    static boolean exceedsMessageLimit(String text) {
        return text.length() > MESSAGE_LIMIT;
    }
}
